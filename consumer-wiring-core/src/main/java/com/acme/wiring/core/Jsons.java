package com.acme.wiring.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public final class Jsons {
    private static final ObjectMapper M = new ObjectMapper().registerModule(new JavaTimeModule());

    private Jsons() {
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return M.readValue(json, clazz);
        } catch (Exception e) {
            throw new PermanentException("Unable to read payload as " + clazz.getSimpleName(), e);
        }
    }
}
