package com.localization.catalog.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Uniqueness key of an entry: its context (null when absent) and msgid text.
 * msgid_plural is deliberately not part of the key.
 */
@Value
public class EntryKey {
    String msgctxt;
    @NonNull
    String msgid;

    public static EntryKey of(String msgctxt, String msgid) {
        return new EntryKey(msgctxt, msgid);
    }

    public static EntryKey of(String msgid) {
        return new EntryKey(null, msgid);
    }
}
