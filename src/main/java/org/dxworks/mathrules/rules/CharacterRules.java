package org.dxworks.mathrules.rules;

import org.dxworks.mathrules.replace.Instruction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Character table: replacement instructions keyed by a character or a short character sequence.
 */
public final class CharacterRules {

    public static final CharacterRules EMPTY = new CharacterRules(Collections.emptyMap());

    private final Map<String, List<Instruction>> entries;
    private final int maxKeyLength;

    public CharacterRules(Map<String, List<Instruction>> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        int max = 0;
        for (String key : entries.keySet()) {
            max = Math.max(max, key.codePointCount(0, key.length()));
        }
        this.maxKeyLength = max;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public List<Instruction> get(String key) {
        return entries.get(key);
    }

    public int getMaxKeyLength() {
        return maxKeyLength;
    }

    /**
     * Later tables override same keys of earlier ones.
     */
    public CharacterRules merge(CharacterRules later) {
        Map<String, List<Instruction>> merged = new LinkedHashMap<>(entries);
        merged.putAll(later.entries);
        return new CharacterRules(merged);
    }
}
