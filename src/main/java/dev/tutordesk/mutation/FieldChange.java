package dev.tutordesk.mutation;

/** One field an update preview would change. */
public record FieldChange(String from, String to) {}
