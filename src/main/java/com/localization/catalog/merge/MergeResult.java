package com.localization.catalog.merge;

import com.localization.catalog.model.Catalog;

import lombok.NonNull;
import lombok.Value;

@Value
public class MergeResult {
    @NonNull
    Catalog catalog;
    @NonNull
    ChangeSummary summary;
}
