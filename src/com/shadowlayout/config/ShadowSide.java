package com.shadowlayout.config;

import static com.shadowlayout.constants.ShadowDefaults.*;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Edges of the container that reserve space for the shadow.
 */
public enum ShadowSide {
	TOP(FLAG_SIDES_TOP), RIGHT(FLAG_SIDES_RIGHT), BOTTOM(FLAG_SIDES_BOTTOM), LEFT(FLAG_SIDES_LEFT);

	private final int flag;

	ShadowSide(int flag) {
		this.flag = flag;
	}

	public int flag() {
		return flag;
	}

	/**
	 * A flag is present when OR-ing it into the mask leaves the mask unchanged.
	 */
	public boolean isIn(int mask) {
		return (mask | flag) == mask;
	}

	public static Set<ShadowSide> fromMask(int mask) {
		EnumSet<ShadowSide> sides = EnumSet.noneOf(ShadowSide.class);
		for (ShadowSide side : values()) {
			if (side.isIn(mask)) {
				sides.add(side);
			}
		}
		return Collections.unmodifiableSet(sides);
	}

	public static int toMask(Set<ShadowSide> sides) {
		int mask = 0;
		for (ShadowSide side : sides) {
			mask |= side.flag;
		}
		return mask;
	}

	public static Set<ShadowSide> all() {
		return fromMask(FLAG_SIDES_ALL);
	}

	/**
	 * Parses either a numeric mask ("5") or side names separated by '|' or ','
	 * ("top|bottom"). Names are case-insensitive.
	 *
	 * @throws IllegalArgumentException on an unknown name or a mask outside 0..15
	 */
	public static Set<ShadowSide> parse(String text) {
		String value = text.trim();
		if (value.isEmpty()) {
			throw new IllegalArgumentException("Empty shadow sides value");
		}
		if (Character.isDigit(value.charAt(0))) {
			int mask = Integer.parseInt(value);
			if (mask < 0 || mask > FLAG_SIDES_ALL) {
				throw new IllegalArgumentException("Shadow sides mask out of range: " + mask);
			}
			return fromMask(mask);
		}
		EnumSet<ShadowSide> sides = EnumSet.noneOf(ShadowSide.class);
		for (String token : value.split("[|,]")) {
			String name = token.trim().toUpperCase(Locale.ROOT);
			if (name.isEmpty()) continue;
			if ("ALL".equals(name)) {
				sides.addAll(EnumSet.allOf(ShadowSide.class));
			} else {
				sides.add(ShadowSide.valueOf(name));
			}
		}
		return Collections.unmodifiableSet(sides);
	}
}
