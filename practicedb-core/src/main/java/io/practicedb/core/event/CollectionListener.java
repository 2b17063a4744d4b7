package io.practicedb.core.event;

@FunctionalInterface
public interface CollectionListener {

    void changed(CollectionChange change);
}
