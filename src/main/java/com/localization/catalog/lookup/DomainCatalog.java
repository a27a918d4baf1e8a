package com.localization.catalog.lookup;

import com.localization.catalog.model.Catalog;

import lombok.NonNull;
import lombok.Value;

/**
 * A catalog together with the locale and domain it translates.
 */
@Value(staticConstructor = "of")
public class DomainCatalog {
    @NonNull
    String locale;
    @NonNull
    String domain;
    @NonNull
    Catalog catalog;
}
