package io.vena.pathspace;

import io.vena.pathspace.glob.GlobMatcher;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import org.pcollections.OrderedPMap;

import static java.util.Objects.requireNonNull;

/**
 * An immutable set of authorization rules, each pairing a glob pattern with a set of {@link Permission}s.
 *
 * <p>
 * A path is authorized for a permission if some pattern matches it and grants
 * that permission (or {@link Permission#ALL}).
 * {@link PathSpace} only checks these; minting them is up to the caller.
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Capabilities {
	private final OrderedPMap<String, Set<Permission>> rules;

	/**
	 * @return capabilities that authorize everything
	 */
	public static Capabilities all() {
		return ALL;
	}

	/**
	 * @return capabilities that authorize nothing
	 */
	public static Capabilities none() {
		return NONE;
	}

	public static Capabilities of(String pattern, Permission... permissions) {
		return none().with(pattern, permissions);
	}

	/**
	 * @return capabilities with the given permissions added for <code>pattern</code>,
	 * keeping any already granted for it.
	 */
	public Capabilities with(String pattern, Permission... permissions) {
		EnumSet<Permission> combined = EnumSet.noneOf(Permission.class);
		Set<Permission> existing = rules.get(requireNonNull(pattern));
		if (existing != null) {
			combined.addAll(existing);
		}
		Collections.addAll(combined, permissions);
		return new Capabilities(rules.plus(pattern, Collections.unmodifiableSet(combined)));
	}

	public Capabilities without(String pattern) {
		return new Capabilities(rules.minus(pattern));
	}

	public boolean permits(Path concretePath, Permission permission) {
		String pathString = concretePath.toString();
		for (Map.Entry<String, Set<Permission>> rule: rules.entrySet()) {
			Set<Permission> granted = rule.getValue();
			if ((granted.contains(permission) || granted.contains(Permission.ALL))
				&& GlobMatcher.matchPath(rule.getKey(), pathString)) {
				return true;
			}
		}
		return false;
	}

	public Map<String, Set<Permission>> rules() {
		return rules;
	}

	@Override
	public String toString() {
		return "Capabilities" + rules;
	}

	private static final Capabilities NONE = new Capabilities(OrderedPMap.empty());
	private static final Capabilities ALL = NONE
		.with("/", Permission.ALL)
		.with("/**", Permission.ALL);
}
