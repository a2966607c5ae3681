package gp.core.model;

import java.util.function.BiConsumer;

/**
 * Walks the frame tree of one tab, starting at the root frame it was bound to.
 *
 * <p>The visitor receives each frame's origin key and its permission consumer.
 * The handle is {@code null} when the frame currently has no live consumer,
 * e.g. after its document was replaced.
 */
@FunctionalInterface
public interface FrameWalker {
    void forEachConsumer(BiConsumer<String, ConsumerHandle> visitor);
}
