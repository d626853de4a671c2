package com.missionguard.domain.model;

/**
 * Entity or event a gap finding refers to.
 */
public record GapSubject(Type type, String name) {

    public enum Type {
        ENTITY,
        EVENT
    }

    public static GapSubject entity(String name) {
        return new GapSubject(Type.ENTITY, name);
    }

    public static GapSubject event(String name) {
        return new GapSubject(Type.EVENT, name);
    }
}
