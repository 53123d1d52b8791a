package io.tabtick.server.capture;

import java.util.List;

public record CaptureStats(int tabsCaptured, int tabsSkipped, int foldersCaptured, List<String> warnings) {
    public CaptureStats {
        warnings = List.copyOf(warnings);
    }
}
