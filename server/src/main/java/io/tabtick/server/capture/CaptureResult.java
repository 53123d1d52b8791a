package io.tabtick.server.capture;

import io.tabtick.core.CollectionRecord;
import io.tabtick.core.FolderRecord;
import io.tabtick.core.TabRecord;

import java.util.List;

/** The persisted record tree of a capture. Folders and tabs are in position order. */
public record CaptureResult(
        CollectionRecord collection,
        List<FolderRecord> folders,
        List<TabRecord> tabs,
        CaptureStats stats
) {}
