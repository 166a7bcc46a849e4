package com.shadowlayout.render;

import static com.shadowlayout.constants.ShadowDefaults.BASE_PAINT_COLOR;

import java.awt.Color;
import java.util.Objects;

/**
 * Mutable paint attributes handed to a {@link DrawSurface}.
 *
 * One instance is reused by every pass of a frame. Whoever changes it must
 * call {@link #reset()} before handing it on, otherwise a stroke or blend mode
 * from one pass leaks into the next.
 */
public class SurfacePaint {

	public enum Style {
		FILL, STROKE
	}

	public enum BlendMode {
		/** Normal source-over painting; the "no blend mode" state. */
		SRC_OVER,
		/** Erase the destination where the source is drawn, in proportion to source alpha. */
		DST_OUT
	}

	private Color color;
	private Style style;
	private float strokeWidth;
	private boolean antiAlias;
	private BlendMode blendMode;
	private ShadowLayer shadowLayer;

	public SurfacePaint() {
		reset();
	}

	public SurfacePaint(Color baseColor) {
		reset(baseColor);
	}

	/** Back to an opaque white anti-aliased fill. */
	public void reset() {
		reset(BASE_PAINT_COLOR);
	}

	public void reset(Color baseColor) {
		this.color = Objects.requireNonNull(baseColor, "baseColor");
		this.style = Style.FILL;
		this.strokeWidth = 0F;
		this.antiAlias = true;
		this.blendMode = BlendMode.SRC_OVER;
		this.shadowLayer = null;
	}

	public boolean isBaseline() {
		return isBaseline(BASE_PAINT_COLOR);
	}

	public boolean isBaseline(Color baseColor) {
		return color.equals(baseColor)
				&& style == Style.FILL
				&& strokeWidth == 0F
				&& antiAlias
				&& blendMode == BlendMode.SRC_OVER
				&& shadowLayer == null;
	}

	public SurfacePaint copy() {
		SurfacePaint p = new SurfacePaint(color);
		p.style = style;
		p.strokeWidth = strokeWidth;
		p.antiAlias = antiAlias;
		p.blendMode = blendMode;
		p.shadowLayer = shadowLayer;
		return p;
	}

	public Color getColor() {
		return color;
	}

	public void setColor(Color color) {
		this.color = Objects.requireNonNull(color, "color");
	}

	public Style getStyle() {
		return style;
	}

	public void setStyle(Style style) {
		this.style = Objects.requireNonNull(style, "style");
	}

	public float getStrokeWidth() {
		return strokeWidth;
	}

	public void setStrokeWidth(float strokeWidth) {
		this.strokeWidth = strokeWidth;
	}

	public boolean isAntiAlias() {
		return antiAlias;
	}

	public void setAntiAlias(boolean antiAlias) {
		this.antiAlias = antiAlias;
	}

	public BlendMode getBlendMode() {
		return blendMode;
	}

	public void setBlendMode(BlendMode blendMode) {
		this.blendMode = Objects.requireNonNull(blendMode, "blendMode");
	}

	public ShadowLayer getShadowLayer() {
		return shadowLayer;
	}

	public void setShadowLayer(float radius, float dx, float dy, Color color) {
		this.shadowLayer = new ShadowLayer(radius, dx, dy, color);
	}

	@Override
	public String toString() {
		return "SurfacePaint[" + style + " " + String.format("#%08X", color.getRGB()) + " stroke=" + strokeWidth
				+ " aa=" + antiAlias + " blend=" + blendMode + " shadow=" + shadowLayer + "]";
	}
}
