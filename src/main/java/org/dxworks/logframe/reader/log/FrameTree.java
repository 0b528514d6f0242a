package org.dxworks.logframe.reader.log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every frame of one log file, in the order their begin markers appear.
 */
public class FrameTree {

    private final List<Frame> frames = new ArrayList<>();
    private int[] siblingOrdinals;

    Frame open(String levelName, Frame parent, int depth, int line) {
        int parentIndex = parent == null ? Frame.NO_PARENT : parent.getIndex();
        Frame frame = new Frame(frames.size(), parentIndex, levelName, depth, line);
        frames.add(frame);
        siblingOrdinals = null;
        return frame;
    }

    public List<Frame> frames() {
        return Collections.unmodifiableList(frames);
    }

    public Frame get(int index) {
        return frames.get(index);
    }

    public int size() {
        return frames.size();
    }

    public Optional<Frame> parent(Frame frame) {
        return frame.hasParent() ? Optional.of(frames.get(frame.getParentIndex())) : Optional.empty();
    }

    /**
     * The frame followed by its parent, grandparent and so on up to the root.
     */
    public List<Frame> ancestry(Frame frame) {
        List<Frame> chain = new ArrayList<>();
        for (Frame current = frame; current != null; current = parent(current).orElse(null)) {
            chain.add(current);
        }
        return chain;
    }

    /**
     * 1-based position of the frame among the frames with the same level name
     * under the same parent.
     */
    public int siblingOrdinal(Frame frame) {
        if (siblingOrdinals == null) {
            siblingOrdinals = computeSiblingOrdinals();
        }
        return siblingOrdinals[frame.getIndex()];
    }

    private int[] computeSiblingOrdinals() {
        int[] ordinals = new int[frames.size()];
        Map<String, Integer> counts = new HashMap<>();
        for (Frame frame : frames) {
            String key = frame.getParentIndex() + "/" + frame.getLevelName();
            ordinals[frame.getIndex()] = counts.merge(key, 1, Integer::sum);
        }
        return ordinals;
    }
}
