package io.opgraph.core.context;

import io.opgraph.core.state.VariablePath;
import io.opgraph.core.util.Values;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Iteration and record frames active at one point of execution.
///
/// Iteration frames and record frames are kept on two separate LIFO stacks. A lookup asks
/// the frames innermost-first and only then the variable store (see {@link ScopedVariables}).
///
/// ### Names bound by an iteration frame
/// - `<itemVariable>` and `<itemVariable>.<path>`: the current item
/// - `<itemVariable>Index`, `<itemVariable>Total`: index and total of that frame
/// - `<indexVariable>`: the index, when the loop declares one
/// - `index`, `total`, `isFirst`, `isLast`: innermost frame only
///
/// The reserved name `current` addresses the innermost record frame (its data plus a
/// `record_id` entry) or, without one, the innermost iteration item.
///
/// ### Contracts
/// - popping an empty stack is a no-op
/// - a stack is never shared between concurrently running branches; use {@link #fork()}
///
/// @implNote **Not thread-safe**. Each branch or iteration owns its own instance.
public final class ContextStack {

    public static final String CURRENT = "current";

    private final Deque<IterationFrame> iterations;
    private final Deque<RecordFrame> records;

    public ContextStack() {
        this.iterations = new ArrayDeque<>();
        this.records = new ArrayDeque<>();
    }

    private ContextStack(Deque<IterationFrame> iterations, Deque<RecordFrame> records) {
        this.iterations = new ArrayDeque<>(iterations);
        this.records = new ArrayDeque<>(records);
    }

    public void pushIterationContext(
            int nodePosition, int currentIndex, String itemVariable, int total) {
        pushIterationContext(
                new IterationFrame(nodePosition, currentIndex, itemVariable, total, null, null));
    }

    public void pushIterationContext(IterationFrame frame) {
        iterations.push(frame);
    }

    /// Removes the innermost iteration frame.
    ///
    /// @return the removed frame, or empty when there was none
    public Optional<IterationFrame> popIterationContext() {
        return Optional.ofNullable(iterations.poll());
    }

    public void pushRecordContext(String recordId, Map<String, Object> recordData) {
        records.push(new RecordFrame(recordId, recordData));
    }

    public Optional<RecordFrame> popRecordContext() {
        return Optional.ofNullable(records.poll());
    }

    /// Returns the innermost record frame, if any.
    public Optional<RecordFrame> getCurrentRecord() {
        return Optional.ofNullable(records.peek());
    }

    public Optional<IterationFrame> getCurrentIteration() {
        return Optional.ofNullable(iterations.peek());
    }

    public int iterationDepth() {
        return iterations.size();
    }

    public int recordDepth() {
        return records.size();
    }

    public boolean isEmpty() {
        return iterations.isEmpty() && records.isEmpty();
    }

    /// Returns an independent copy holding the same frames. Frames are immutable, so pushes
    /// and pops on either copy never affect the other.
    public ContextStack fork() {
        return new ContextStack(iterations, records);
    }

    /// Frames innermost first.
    public List<IterationFrame> iterationFrames() {
        return new ArrayList<>(iterations);
    }

    /// Namespaces a variable name with the active iteration chain, outermost first, e.g.
    /// `email@iter:3:0/iter:5:2`. Without active frames the name is returned unchanged.
    public String storageKey(String name) {
        if (iterations.isEmpty()) {
            return name;
        }
        List<String> parts = new ArrayList<>();
        Iterator<IterationFrame> outermostFirst = iterations.descendingIterator();
        while (outermostFirst.hasNext()) {
            IterationFrame frame = outermostFirst.next();
            parts.add("iter:" + frame.nodePosition() + ":" + frame.currentIndex());
        }
        return name + "@" + String.join("/", parts);
    }

    /// Resolves a path against the frames only.
    ///
    /// @param path dotted path, not null
    /// @return a frame-scoped match, {@link FrameMatch#NONE} when no frame binds the root name
    FrameMatch resolve(String path) {
        List<String> segments = VariablePath.parse(path);
        if (segments.isEmpty()) {
            return FrameMatch.NONE;
        }
        String head = segments.get(0);
        List<String> rest = segments.subList(1, segments.size());

        if (CURRENT.equals(head)) {
            Optional<Object> current = currentValue();
            if (current.isPresent()) {
                return FrameMatch.of(VariablePath.navigate(current.get(), rest));
            }
        }

        boolean innermost = true;
        for (IterationFrame frame : iterations) {
            if (head.equals(frame.itemVariable())) {
                if (frame.item() == null) {
                    return FrameMatch.inStore(storageKeyFor(frame), rest);
                }
                return FrameMatch.of(VariablePath.navigate(frame.item(), rest));
            }
            if (rest.isEmpty()) {
                Object bound = scalarBinding(frame, head, innermost);
                if (bound != null) {
                    return FrameMatch.of(Optional.of(bound));
                }
            }
            innermost = false;
        }
        return FrameMatch.NONE;
    }

    private Optional<Object> currentValue() {
        RecordFrame record = records.peek();
        if (record != null) {
            Map<String, Object> view = new LinkedHashMap<>(record.recordData());
            view.putIfAbsent("record_id", record.recordId());
            return Optional.of(view);
        }
        IterationFrame frame = iterations.peek();
        return frame != null ? Optional.ofNullable(frame.item()) : Optional.empty();
    }

    private static Object scalarBinding(IterationFrame frame, String name, boolean innermost) {
        if (name.equals(frame.itemVariable() + "Index")
                || name.equals(frame.indexVariable())) {
            return frame.currentIndex();
        }
        if (name.equals(frame.itemVariable() + "Total")) {
            return frame.total();
        }
        if (!innermost) {
            return null;
        }
        return switch (name) {
            case "index" -> frame.currentIndex();
            case "total" -> frame.total();
            case "isFirst" -> frame.isFirst();
            case "isLast" -> frame.isLast();
            default -> null;
        };
    }

    /// Storage key of a frame's item, built from that frame and the frames enclosing it.
    private String storageKeyFor(IterationFrame target) {
        List<String> parts = new ArrayList<>();
        Iterator<IterationFrame> outermostFirst = iterations.descendingIterator();
        while (outermostFirst.hasNext()) {
            IterationFrame frame = outermostFirst.next();
            parts.add("iter:" + frame.nodePosition() + ":" + frame.currentIndex());
            if (frame == target) {
                break;
            }
        }
        return target.itemVariable() + "@" + String.join("/", parts);
    }

    /// Outcome of a frame lookup.
    ///
    /// @param bound whether a frame binds the name
    /// @param value the value when found directly in the frame
    /// @param storageKey when set, the value lives in the variable store under this key
    /// @param rest remaining path segments to apply below the storage key
    record FrameMatch(boolean bound, Optional<Object> value, String storageKey, List<String> rest) {

        static final FrameMatch NONE = new FrameMatch(false, Optional.empty(), null, List.of());

        static FrameMatch of(Optional<Object> value) {
            return new FrameMatch(true, value.map(Values::deepCopy), null, List.of());
        }

        static FrameMatch inStore(String key, List<String> rest) {
            return new FrameMatch(true, Optional.empty(), key, List.copyOf(rest));
        }
    }
}
