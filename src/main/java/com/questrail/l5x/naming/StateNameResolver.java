package com.questrail.l5x.naming;

import com.questrail.l5x.api.ControllerProject;
import com.questrail.l5x.api.ControllerTag;
import com.questrail.l5x.api.TagLookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * StateNameResolver
 * -----------------------------------------------------------------------------
 * Resolves a state id to the human-readable name stored in the description of
 * bit {@code id} of element {@value #STATE_ELEMENT} of the state-bit member.
 *
 * <h2>Description layout</h2>
 * <pre>
 *   State 4                   &lt;- header line, dropped
 *   Wait For Clamp            &lt;- display name
 *   Closed                    &lt;- (continued)
 * </pre>
 *
 * <h2>Fallback contract</h2>
 * Resolution never fails. An unknown tag, an unresolvable bit address, a
 * missing, blank or header-only description, or any fault raised by the
 * document provider all produce {@link StateNameTable#defaultName(int)}.
 */
public final class StateNameResolver
{
    private static final Logger log = LoggerFactory.getLogger(StateNameResolver.class);

    /** Element of the state-bit array holding the state flags. */
    public static final int STATE_ELEMENT = 0;

    private final String stateBitMember;

    public StateNameResolver(String stateBitMember) {
        this.stateBitMember = Objects.requireNonNull(stateBitMember, "stateBitMember");
    }

    /**
     * Resolves names for every id in {@code states}.
     */
    public StateNameTable resolveAll(ControllerProject project, String tagName, Collection<Integer> states) {
        Objects.requireNonNull(states, "states");
        Map<Integer, String> names = new TreeMap<>();
        for (Integer state : states) {
            names.put(state, resolve(project, tagName, state));
        }
        return StateNameTable.of(names);
    }

    /**
     * Resolves one state name, falling back to the default name.
     */
    public String resolve(ControllerProject project, String tagName, int state) {
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(tagName, "tagName");
        try {
            return lookup(project, tagName, state).orElseGet(() -> StateNameTable.defaultName(state));
        } catch (TagLookupException e) {
            log.debug("No name for state {} on {}: {}", state, tagName, e.getMessage());
        } catch (RuntimeException e) {
            log.debug("Name lookup for state {} on {} failed", state, tagName, e);
        }
        return StateNameTable.defaultName(state);
    }

    private Optional<String> lookup(ControllerProject project, String tagName, int state) throws TagLookupException {
        ControllerTag tag = project.tag(tagName)
                .orElseThrow(() -> new TagLookupException("Unknown tag " + tagName));
        return tag.bitDescription(stateBitMember, STATE_ELEMENT, state)
                .flatMap(StateNameResolver::displayName);
    }

    /**
     * Extracts the display name from a multi-line bit description: all lines
     * after the first, joined with newlines and trimmed.
     *
     * @return the name, or empty if the description has no usable name lines
     */
    static Optional<String> displayName(String description) {
        if (description == null) {
            return Optional.empty();
        }
        String normalized = description.replace("\r\n", "\n").replace('\r', '\n').strip();
        int firstBreak = normalized.indexOf('\n');
        if (firstBreak < 0) {
            return Optional.empty();
        }
        String name = normalized.substring(firstBreak + 1).strip();
        return name.isEmpty() ? Optional.empty() : Optional.of(name);
    }
}
