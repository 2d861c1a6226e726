package com.conveyal.catstronauts.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A track as the remote catalogue emits it. The author is referenced only by its id, the exposed Track type turns
 * that into a nested author object.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrackRecord {

    public String id;
    public String title;
    public String authorId;
    public String thumbnail;
    public String topic;
    /** Approximate length in seconds. */
    public Integer length;
    public Integer modulesCount;
    public String description;
    public Integer numberOfViews;
    public String createdAt;

    @Override
    public String toString() {
        return String.format("Track %s (author %s)", id, authorId);
    }
}
