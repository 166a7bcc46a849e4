package com.shadowlayout.render;

import java.awt.geom.Path2D;
import java.awt.geom.Rectangle2D;
import java.awt.geom.RoundRectangle2D;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import com.shadowlayout.config.ShadowConfig;
import com.shadowlayout.geometry.ContentGeometry;
import com.shadowlayout.render.SurfacePaint.BlendMode;
import com.shadowlayout.render.SurfacePaint.Style;
import com.shadowlayout.util.LoggerSetup;

/**
 * Draws one frame of a shadow layout in three passes:
 * <ol>
 * <li>shadow: a rounded rectangle filled over the content area with a shadow layer;</li>
 * <li>content: children painted into an isolated layer whose four corners are
 * then erased with DST_OUT, leaving rounded corners;</li>
 * <li>border: a stroked rounded rectangle on top of the rounded content.</li>
 * </ol>
 * The order is fixed. Children sit on top of the shadow, and the border is drawn
 * after masking so it is not itself cut by the mask.
 *
 * The paint and mask path are owned by this instance and reused by every pass.
 * Each pass resets them before returning, including when a child painter throws.
 * An instance must not render two frames at once.
 */
public class RenderPipeline {
	private static final Logger logger = LoggerSetup.getLogger(RenderPipeline.class);

	private final SurfacePaint paint = new SurfacePaint();
	private final Path2D.Float maskPath = new Path2D.Float(Path2D.WIND_EVEN_ODD);

	/**
	 * @return false when the frame was skipped because the surface is missing or
	 *         the geometry has not been resolved yet
	 */
	public boolean draw(DrawSurface surface, ContentGeometry geometry, ShadowConfig config, ChildPainter children) {
		if (surface == null) {
			logger.fine("No drawing surface, frame skipped");
			return false;
		}
		if (geometry == null || !geometry.isResolved()) {
			logger.fine("Geometry not resolved yet, frame skipped");
			return false;
		}
		Objects.requireNonNull(config, "config");
		Objects.requireNonNull(children, "children");

		int depth = surface.getSaveCount();
		try {
			drawShadow(surface, geometry, config);
			drawContent(surface, geometry, config, children);
			drawBorder(surface, geometry, config);
		} finally {
			if (surface.getSaveCount() != depth) {
				logger.warning("Unbalanced surface after frame (" + surface.getSaveCount() + " vs " + depth
						+ "), restoring");
				surface.restoreToCount(depth);
			}
		}
		return true;
	}

	void drawShadow(DrawSurface surface, ContentGeometry geometry, ShadowConfig config) {
		float radius = config.getCornerRadius();
		surface.save();
		try {
			paint.setShadowLayer(config.getShadowWidth(), config.getDx(), config.getDy(), config.getShadowColor());
			surface.drawRoundRect(geometry.getContentRect(), radius, radius, paint);
		} finally {
			paint.reset();
			surface.restore();
		}
	}

	void drawContent(DrawSurface surface, ContentGeometry geometry, ShadowConfig config, ChildPainter children) {
		float radius = config.getCornerRadius();
		int count = surface.saveLayer(0F, 0F, surface.getWidth(), surface.getHeight());
		try {
			children.paint(surface);

			// Even-odd between the box and the rounded box leaves only the four corners
			Rectangle2D.Float content = geometry.getContentRect();
			maskPath.setWindingRule(Path2D.WIND_EVEN_ODD);
			maskPath.append(content, false);
			maskPath.append(new RoundRectangle2D.Float(content.x, content.y, content.width, content.height,
					radius * 2F, radius * 2F), false);

			paint.setBlendMode(BlendMode.DST_OUT);
			surface.drawPath(maskPath, paint);
		} finally {
			paint.reset();
			maskPath.reset();
			surface.restoreToCount(count);
		}
	}

	void drawBorder(DrawSurface surface, ContentGeometry geometry, ShadowConfig config) {
		Optional<Rectangle2D.Float> border = geometry.getBorderRect();
		if (!border.isPresent()) {
			return;
		}
		float radius = config.getCornerRadius();
		surface.save();
		try {
			paint.setStrokeWidth(config.getBorderWidth());
			paint.setStyle(Style.STROKE);
			paint.setColor(config.getBorderColor());
			surface.drawRoundRect(border.get(), radius, radius, paint);
		} finally {
			paint.reset();
			surface.restore();
		}
	}

	SurfacePaint paint() {
		return paint;
	}

	Path2D.Float maskPath() {
		return maskPath;
	}
}
