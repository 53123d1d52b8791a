package io.tabtick.core.browser;

public record LiveGroup(
        int id,
        int windowId,
        String title,
        String color,
        boolean collapsed
) {}
