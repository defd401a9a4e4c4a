package io.spectr.markdown.impl;

import io.spectr.markdown.api.Document;

/**
 * Gives the engine internals the arena and source bytes of a {@link Document}, which its public
 * API keeps private.
 *
 * <p>{@link Document} installs the single implementation when its class is initialized; the
 * accessors are visible to this package only.
 */
public abstract class DocumentAccess {
    private static volatile DocumentAccess instance;

    protected DocumentAccess() {}

    /**
     * Registers the implementation. Called once by {@link Document}.
     *
     * @throws IllegalStateException if an implementation is already installed
     */
    public static synchronized void install(DocumentAccess access) {
        if (instance != null) {
            throw new IllegalStateException("DocumentAccess is already installed");
        }
        instance = access;
    }

    protected abstract NodeArena arena(Document doc);

    protected abstract byte[] source(Document doc);

    protected abstract Document create(byte[] source, NodeArena arena, int root);

    private static DocumentAccess get() {
        DocumentAccess access = instance;
        if (access == null) {
            try {
                // runs Document's static initializer
                Class.forName(Document.class.getName(), true, Document.class.getClassLoader());
            } catch (ClassNotFoundException e) {
                throw new IllegalStateException(e);
            }
            access = instance;
        }
        return access;
    }

    static NodeArena arenaOf(Document doc) {
        return get().arena(doc);
    }

    static byte[] sourceOf(Document doc) {
        return get().source(doc);
    }

    static Document newDocument(byte[] source, NodeArena arena, int root) {
        return get().create(source, arena, root);
    }
}
