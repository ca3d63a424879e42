package de.bsommerfeld.updatecreator.engine.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Added and modified files of one run, in the order they were copied. Every copy adds one
 * entry; nothing is deduplicated.
 */
public final class ChangeManifest {

    private final List<String> added = new ArrayList<>();
    private final List<String> modified = new ArrayList<>();

    public void record(ChangeRecord record) {
        switch (record.type()) {
            case ADDED -> added.add(record.destination());
            case MODIFIED -> modified.add(record.destination());
        }
    }

    public List<String> added() {
        return Collections.unmodifiableList(added);
    }

    public List<String> modified() {
        return Collections.unmodifiableList(modified);
    }

    public boolean isEmpty() {
        return added.isEmpty() && modified.isEmpty();
    }

    public int size() {
        return added.size() + modified.size();
    }
}
