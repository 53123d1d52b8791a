package io.tabtick.core.browser;

import io.tabtick.core.WindowState;

public record LiveWindow(
        int id,
        Integer left,
        Integer top,
        Integer width,
        Integer height,
        WindowState state,
        boolean focused
) {}
