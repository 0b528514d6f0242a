package org.dxworks.logframe.reader.log;

import java.util.Map;

/**
 * Chooses the name used to qualify an ambiguous key, as in {@code CarriedVal[Session]}.
 */
@FunctionalInterface
public interface LevelNamer {

    /**
     * @param frame      the frame holding the ambiguous key
     * @param levelNames level number to the first marker name seen at that level
     */
    String nameFor(Frame frame, Map<Integer, String> levelNames);

    /**
     * Names a level after its begin marker ({@code Session}, {@code Block}, ...).
     */
    static LevelNamer markerName() {
        return (frame, levelNames) -> {
            String name = levelNames.get(frame.getLevel());
            return name == null || name.isBlank() ? Integer.toString(frame.getLevel()) : name;
        };
    }

    /**
     * Names a level after the frame's value for {@code key}, e.g. its
     * {@code Procedure}; frames without the key use their level number.
     */
    static LevelNamer byKey(String key) {
        return (frame, levelNames) -> {
            String value = frame.get(key);
            return value == null || value.isBlank() ? Integer.toString(frame.getLevel()) : value;
        };
    }
}
