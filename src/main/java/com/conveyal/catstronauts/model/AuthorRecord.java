package com.conveyal.catstronauts.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AuthorRecord {

    public String id;
    public String name;
    public String photo;

    @Override
    public String toString() {
        return String.format("Author %s", id);
    }
}
