package com.phillippitts.bbdetector.service.sync;

/**
 * Character attribute snapshot recorded on the session service.
 *
 * @param level character level, 1-544
 * @param vitality attribute, 1-99 like the five that follow
 */
public record CharacterStats(int level, int vitality, int endurance, int strength, int skill,
                             int bloodtinge, int arcane) {

    static final int MAX_LEVEL = 544;
    static final int MAX_ATTRIBUTE = 99;

    public CharacterStats {
        check("level", level, MAX_LEVEL);
        check("vitality", vitality, MAX_ATTRIBUTE);
        check("endurance", endurance, MAX_ATTRIBUTE);
        check("strength", strength, MAX_ATTRIBUTE);
        check("skill", skill, MAX_ATTRIBUTE);
        check("bloodtinge", bloodtinge, MAX_ATTRIBUTE);
        check("arcane", arcane, MAX_ATTRIBUTE);
    }

    private static void check(String name, int value, int max) {
        if (value < 1 || value > max) {
            throw new IllegalArgumentException(name + " must be in [1, " + max + "], got " + value);
        }
    }
}
