package org.example.coach.service.conversation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-user view history backing the generic back action.
 * <p>
 * The bottom frame is always the main menu and is never popped. Pushing the frame already
 * on top is a no-op.
 */
public class NavigationStack {

    private final List<NavFrame> frames = new ArrayList<>();

    public NavigationStack() {
        frames.add(NavFrame.ROOT);
    }

    /**
     * @return false if the frame was already on top
     */
    public boolean push(NavFrame frame) {
        if (frame == null || peek().equals(frame)) {
            return false;
        }
        frames.add(frame);
        return true;
    }

    public boolean push(ViewId view) {
        return push(NavFrame.of(view));
    }

    /**
     * Removes the top frame. Returns empty when only the root remains.
     */
    public Optional<NavFrame> pop() {
        if (frames.size() <= 1) {
            return Optional.empty();
        }
        return Optional.of(frames.remove(frames.size() - 1));
    }

    public NavFrame peek() {
        return frames.get(frames.size() - 1);
    }

    public void reset() {
        frames.clear();
        frames.add(NavFrame.ROOT);
    }

    /**
     * Overwrites the top frame, or pushes when only the root is present.
     */
    public void replaceTop(NavFrame frame) {
        if (frames.size() <= 1) {
            push(frame);
            return;
        }
        frames.set(frames.size() - 1, frame);
    }

    /**
     * Pops the top frame if it shows {@code view}.
     */
    public boolean dropTopIf(ViewId view) {
        if (frames.size() > 1 && peek().view() == view) {
            frames.remove(frames.size() - 1);
            return true;
        }
        return false;
    }

    public int size() {
        return frames.size();
    }

    public List<NavFrame> frames() {
        return List.copyOf(frames);
    }

    public NavigationStack copy() {
        NavigationStack copy = new NavigationStack();
        copy.frames.clear();
        copy.frames.addAll(frames);
        return copy;
    }
}
