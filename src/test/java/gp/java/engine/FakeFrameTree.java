package gp.java.engine;

import gp.core.model.ConsumerHandle;
import gp.core.model.FrameWalker;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * In-memory frame tree of one tab. Each frame has an origin and, optionally,
 * a consumer that records the decisions it receives.
 */
final class FakeFrameTree implements FrameWalker {

    private final List<Frame> frames = new ArrayList<>();

    /**
     * Adds a frame with a live consumer.
     *
     * @return the frame's consumer
     */
    synchronized RecordingConsumer addFrame(String origin) {
        RecordingConsumer consumer = new RecordingConsumer();
        frames.add(new Frame(origin, consumer));
        return consumer;
    }

    /**
     * Adds a frame whose document has no permission consumer.
     */
    synchronized void addFrameWithoutConsumer(String origin) {
        frames.add(new Frame(origin, null));
    }

    @Override
    public void forEachConsumer(BiConsumer<String, ConsumerHandle> visitor) {
        List<Frame> snapshot;
        synchronized (this) {
            snapshot = List.copyOf(frames);
        }
        for (Frame frame : snapshot) {
            visitor.accept(frame.origin(), frame.consumer());
        }
    }

    private record Frame(String origin, ConsumerHandle consumer) {
    }

    static final class RecordingConsumer implements ConsumerHandle {

        private final List<Boolean> received = new ArrayList<>();

        @Override
        public synchronized void setAllowed(boolean allow) {
            received.add(allow);
        }

        synchronized List<Boolean> received() {
            return List.copyOf(received);
        }
    }
}
