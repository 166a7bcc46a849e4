package com.shadowlayout.geometry;

import java.awt.geom.Rectangle2D;
import java.util.Optional;

/**
 * Rectangles resolved for one container size. {@link #UNRESOLVED} stands for
 * "no size seen yet"; nothing may be drawn from it.
 */
public final class ContentGeometry {
	public static final ContentGeometry UNRESOLVED = new ContentGeometry(0, 0, null, null);

	private final int width;
	private final int height;
	private final Rectangle2D.Float contentRect;
	private final Rectangle2D.Float borderRect;

	ContentGeometry(int width, int height, Rectangle2D.Float contentRect, Rectangle2D.Float borderRect) {
		this.width = width;
		this.height = height;
		this.contentRect = contentRect;
		this.borderRect = borderRect;
	}

	public boolean isResolved() {
		return contentRect != null;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	/**
	 * @throws IllegalStateException before the first resize
	 */
	public Rectangle2D.Float getContentRect() {
		if (contentRect == null) {
			throw new IllegalStateException("Geometry has not been resolved yet");
		}
		return (Rectangle2D.Float) contentRect.clone();
	}

	public Optional<Rectangle2D.Float> getBorderRect() {
		return borderRect == null ? Optional.empty() : Optional.of((Rectangle2D.Float) borderRect.clone());
	}

	@Override
	public String toString() {
		if (!isResolved()) {
			return "ContentGeometry[unresolved]";
		}
		return "ContentGeometry[" + width + "x" + height + " content=" + describe(contentRect) + " border="
				+ (borderRect == null ? "none" : describe(borderRect)) + "]";
	}

	private static String describe(Rectangle2D r) {
		return "(" + r.getMinX() + "," + r.getMinY() + " - " + r.getMaxX() + "," + r.getMaxY() + ")";
	}
}
