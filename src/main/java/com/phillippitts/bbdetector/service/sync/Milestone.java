package com.phillippitts.bbdetector.service.sync;

/**
 * Milestone fields carried by add and edit commands.
 *
 * @param id server-assigned id; null when adding
 * @param icon null or blank means the default icon on add
 * @param timestamp session time in ms; null keeps the server's value on edit
 */
public record Milestone(String id, String name, String icon, Long timestamp) {

    public static Milestone of(String name, String icon) {
        return new Milestone(null, name, icon, null);
    }
}
