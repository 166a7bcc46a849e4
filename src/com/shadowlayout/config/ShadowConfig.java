package com.shadowlayout.config;

import static com.shadowlayout.constants.ShadowDefaults.*;

import java.awt.Color;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Geometry and colour parameters of a {@code ShadowLayout}, in physical pixels.
 * Instances are immutable; the render pipeline only reads them.
 */
public final class ShadowConfig {
	private final Color shadowColor;
	private final float shadowWidth;
	private final float dx;
	private final float dy;
	private final float cornerRadius;
	private final Color borderColor;
	private final float borderWidth;
	private final Set<ShadowSide> shadowSides;

	private ShadowConfig(Builder b) {
		this.shadowColor = b.shadowColor;
		this.shadowWidth = b.shadowWidth;
		this.dx = b.dx;
		this.dy = b.dy;
		this.cornerRadius = b.cornerRadius;
		this.borderColor = b.borderColor;
		this.borderWidth = b.borderWidth;
		this.shadowSides = Collections.unmodifiableSet(EnumSet.copyOf(b.shadowSides));
	}

	public static ShadowConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.shadowColor(shadowColor)
				.shadowWidth(shadowWidth)
				.offset(dx, dy)
				.cornerRadius(cornerRadius)
				.borderColor(borderColor)
				.borderWidth(borderWidth)
				.shadowSides(shadowSides);
	}

	public Color getShadowColor() {
		return shadowColor;
	}

	public float getShadowWidth() {
		return shadowWidth;
	}

	public float getDx() {
		return dx;
	}

	public float getDy() {
		return dy;
	}

	public float getCornerRadius() {
		return cornerRadius;
	}

	public Color getBorderColor() {
		return borderColor;
	}

	public float getBorderWidth() {
		return borderWidth;
	}

	public Set<ShadowSide> getShadowSides() {
		return shadowSides;
	}

	public boolean hasShadowSide(ShadowSide side) {
		return shadowSides.contains(side);
	}

	public int getShadowSidesMask() {
		return ShadowSide.toMask(shadowSides);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ShadowConfig)) return false;
		ShadowConfig other = (ShadowConfig) o;
		return Float.compare(shadowWidth, other.shadowWidth) == 0
				&& Float.compare(dx, other.dx) == 0
				&& Float.compare(dy, other.dy) == 0
				&& Float.compare(cornerRadius, other.cornerRadius) == 0
				&& Float.compare(borderWidth, other.borderWidth) == 0
				&& shadowColor.equals(other.shadowColor)
				&& borderColor.equals(other.borderColor)
				&& shadowSides.equals(other.shadowSides);
	}

	@Override
	public int hashCode() {
		return Objects.hash(shadowColor, shadowWidth, dx, dy, cornerRadius, borderColor, borderWidth, shadowSides);
	}

	@Override
	public String toString() {
		return "ShadowConfig[shadow=" + shadowWidth + "px " + hex(shadowColor) + " offset=(" + dx + "," + dy
				+ ") radius=" + cornerRadius + " border=" + borderWidth + "px " + hex(borderColor)
				+ " sides=" + shadowSides + "]";
	}

	private static String hex(Color c) {
		return String.format("#%08X", c.getRGB());
	}

	public static final class Builder {
		private Color shadowColor = DEF_SHADOW_COLOR;
		private float shadowWidth = DEF_SHADOW_WIDTH;
		private float dx = DEF_DX;
		private float dy = DEF_DY;
		private float cornerRadius = DEF_CORNER_RADIUS;
		private Color borderColor = DEF_BORDER_COLOR;
		private float borderWidth = DEF_BORDER_WIDTH;
		private EnumSet<ShadowSide> shadowSides = EnumSet.noneOf(ShadowSide.class);

		private Builder() {
			shadowSides.addAll(ShadowSide.fromMask(DEF_SHADOW_SIDES));
		}

		public Builder shadowColor(Color color) {
			this.shadowColor = Objects.requireNonNull(color, "shadowColor");
			return this;
		}

		public Builder shadowWidth(float width) {
			this.shadowWidth = width;
			return this;
		}

		public Builder dx(float dx) {
			this.dx = dx;
			return this;
		}

		public Builder dy(float dy) {
			this.dy = dy;
			return this;
		}

		public Builder offset(float dx, float dy) {
			this.dx = dx;
			this.dy = dy;
			return this;
		}

		public Builder cornerRadius(float radius) {
			this.cornerRadius = radius;
			return this;
		}

		public Builder borderColor(Color color) {
			this.borderColor = Objects.requireNonNull(color, "borderColor");
			return this;
		}

		public Builder borderWidth(float width) {
			this.borderWidth = width;
			return this;
		}

		public Builder shadowSides(Set<ShadowSide> sides) {
			this.shadowSides = EnumSet.noneOf(ShadowSide.class);
			this.shadowSides.addAll(Objects.requireNonNull(sides, "shadowSides"));
			return this;
		}

		public Builder shadowSides(ShadowSide first, ShadowSide... rest) {
			return shadowSides(EnumSet.of(first, rest));
		}

		public Builder shadowSidesMask(int mask) {
			return shadowSides(ShadowSide.fromMask(mask));
		}

		public ShadowConfig build() {
			requireNonNegative("shadowWidth", shadowWidth);
			requireNonNegative("cornerRadius", cornerRadius);
			requireNonNegative("borderWidth", borderWidth);
			if (!Float.isFinite(dx) || !Float.isFinite(dy)) {
				throw new IllegalArgumentException("Shadow offset must be finite: (" + dx + ", " + dy + ")");
			}
			return new ShadowConfig(this);
		}

		private static void requireNonNegative(String name, float value) {
			if (!(value >= 0F) || Float.isInfinite(value)) {
				throw new IllegalArgumentException(name + " must be a finite value >= 0, got " + value);
			}
		}
	}
}
