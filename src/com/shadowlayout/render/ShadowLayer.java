package com.shadowlayout.render;

import java.awt.Color;
import java.util.Objects;

/**
 * Blurred, offset copy of a filled shape painted underneath it.
 */
public final class ShadowLayer {
	private final float radius;
	private final float dx;
	private final float dy;
	private final Color color;

	public ShadowLayer(float radius, float dx, float dy, Color color) {
		this.radius = radius;
		this.dx = dx;
		this.dy = dy;
		this.color = Objects.requireNonNull(color, "color");
	}

	public float getRadius() {
		return radius;
	}

	public float getDx() {
		return dx;
	}

	public float getDy() {
		return dy;
	}

	public Color getColor() {
		return color;
	}

	/** A radius of zero or less draws nothing. */
	public boolean isVisible() {
		return radius > 0F && color.getAlpha() > 0;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ShadowLayer)) return false;
		ShadowLayer other = (ShadowLayer) o;
		return Float.compare(radius, other.radius) == 0 && Float.compare(dx, other.dx) == 0
				&& Float.compare(dy, other.dy) == 0 && color.equals(other.color);
	}

	@Override
	public int hashCode() {
		return Objects.hash(radius, dx, dy, color);
	}

	@Override
	public String toString() {
		return "ShadowLayer[r=" + radius + " dx=" + dx + " dy=" + dy + " color=" + String.format("#%08X", color.getRGB()) + "]";
	}
}
