package com.powerguard.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.powerguard.anomaly.exception.UnknownModelException;

public enum ModelType {
    ISOLATION_FOREST("isolation_forest"),
    AUTOENCODER("autoencoder");

    private final String id;

    ModelType(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public static ModelType fromId(String id) {
        if (id != null) {
            for (ModelType type : values()) {
                if (type.id.equalsIgnoreCase(id.trim())) {
                    return type;
                }
            }
        }
        throw new UnknownModelException(id);
    }
}
