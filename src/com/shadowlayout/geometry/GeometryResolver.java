package com.shadowlayout.geometry;

import static com.shadowlayout.constants.ShadowDefaults.BORDER_INSET_DIVISOR;

import java.awt.Insets;
import java.awt.geom.Rectangle2D;
import java.util.logging.Logger;

import com.shadowlayout.util.LoggerSetup;

/**
 * Derives the content and border rectangles from the container size.
 */
public final class GeometryResolver {
	private static final Logger logger = LoggerSetup.getLogger(GeometryResolver.class);

	private GeometryResolver() {
	}

	/**
	 * Content rectangle spans (padding.left, padding.top) to
	 * (width - padding.right, height - padding.bottom). When the padding is
	 * larger than the size, the far edge is pinned to the near one so the
	 * rectangle stays well-formed with zero extent.
	 *
	 * The border rectangle exists only for a positive border width and is the
	 * content rectangle inset by a third of that width on every edge.
	 */
	public static ContentGeometry onResize(int width, int height, Insets padding, float borderWidth) {
		if (width < 0 || height < 0) {
			throw new IllegalArgumentException("Negative size " + width + "x" + height);
		}
		float left = padding.left;
		float top = padding.top;
		float right = Math.max(left, width - padding.right);
		float bottom = Math.max(top, height - padding.bottom);
		Rectangle2D.Float content = new Rectangle2D.Float(left, top, right - left, bottom - top);

		Rectangle2D.Float border = null;
		float inset = borderWidth / BORDER_INSET_DIVISOR;
		if (inset > 0F) {
			border = new Rectangle2D.Float(
					left + inset,
					top + inset,
					(right - inset) - (left + inset),
					(bottom - inset) - (top + inset));
		}

		ContentGeometry geometry = new ContentGeometry(width, height, content, border);
		logger.fine("Resolved " + geometry);
		return geometry;
	}
}
