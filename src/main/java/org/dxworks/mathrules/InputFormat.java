package org.dxworks.mathrules;

public enum InputFormat {
    MATHML("mathml"),
    JSON("json");

    private final String name;

    InputFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
