package ir.operand;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Waveform reference of a PULSE or CAPTURE, e.g. {@code flat(duration: 1e-6, iq: 1.0)}.
 * Parameter values are kept as rendered expressions; they are never evaluated here.
 */
public final class WaveformInvocation {
    private final String name;
    private final Map<String, String> parameters;

    public WaveformInvocation(String name, Map<String, String> parameters) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("waveform name must not be blank");
        }
        this.name = name;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static WaveformInvocation named(String name) {
        return new WaveformInvocation(name, Map.of());
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    public String toQuil() {
        if (parameters.isEmpty()) {
            return name;
        }
        return name + parameters.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof WaveformInvocation)) return false;
        WaveformInvocation that = (WaveformInvocation) obj;
        return name.equals(that.name) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameters);
    }

    @Override
    public String toString() {
        return toQuil();
    }
}
