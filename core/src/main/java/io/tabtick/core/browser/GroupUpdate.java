package io.tabtick.core.browser;

public record GroupUpdate(String title, String color, boolean collapsed) {}
