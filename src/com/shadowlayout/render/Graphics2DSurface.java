package com.shadowlayout.render;

import java.awt.AlphaComposite;
import java.awt.BasicStroke;
import java.awt.Composite;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Shape;
import java.awt.geom.AffineTransform;
import java.awt.geom.Path2D;
import java.awt.geom.Rectangle2D;
import java.awt.geom.RoundRectangle2D;
import java.awt.image.BufferedImage;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * {@link DrawSurface} backed by a {@code Graphics2D}.
 *
 * Layers are ARGB images in software memory. They are rasterized at the
 * device scale of the base graphics so children stay sharp on HiDPI screens,
 * and composited back with SRC_OVER on restore. DST_OUT only ever runs against
 * such an image, never against the screen.
 *
 * The surface does not own the base graphics and never disposes it.
 */
public class Graphics2DSurface implements DrawSurface {

	private static final class Frame {
		final Graphics2D g;
		final BufferedImage layer;
		final double scaleX;
		final double scaleY;

		Frame(Graphics2D g, BufferedImage layer, double scaleX, double scaleY) {
			this.g = g;
			this.layer = layer;
			this.scaleX = scaleX;
			this.scaleY = scaleY;
		}
	}

	private final int width;
	private final int height;
	private final Deque<Frame> stack = new ArrayDeque<>();

	public Graphics2DSurface(Graphics2D base, int width, int height) {
		Objects.requireNonNull(base, "base");
		if (width < 0 || height < 0) {
			throw new IllegalArgumentException("Negative surface size " + width + "x" + height);
		}
		this.width = width;
		this.height = height;
		stack.push(new Frame(base, null, 1D, 1D));
	}

	/**
	 * Surface drawing straight into an image. The caller disposes the returned
	 * surface's {@link #graphics()} when done.
	 */
	public static Graphics2DSurface onImage(BufferedImage image) {
		return new Graphics2DSurface(image.createGraphics(), image.getWidth(), image.getHeight());
	}

	@Override
	public int getWidth() {
		return width;
	}

	@Override
	public int getHeight() {
		return height;
	}

	@Override
	public int save() {
		int count = stack.size();
		stack.push(new Frame((Graphics2D) top().g.create(), null, 1D, 1D));
		return count;
	}

	@Override
	public int saveLayer(float left, float top, float right, float bottom) {
		int count = stack.size();
		Graphics2D parent = top().g;

		double sx = 1D;
		double sy = 1D;
		AffineTransform device = parent.getTransform();
		if ((device.getType() & ~(AffineTransform.TYPE_TRANSLATION | AffineTransform.TYPE_MASK_SCALE)) == 0) {
			sx = Math.max(1D, Math.abs(device.getScaleX()));
			sy = Math.max(1D, Math.abs(device.getScaleY()));
		}
		int lw = Math.max(1, (int) Math.ceil(width * sx));
		int lh = Math.max(1, (int) Math.ceil(height * sy));

		BufferedImage layer = new BufferedImage(lw, lh, BufferedImage.TYPE_INT_ARGB);
		Graphics2D lg = layer.createGraphics();
		lg.setRenderingHints(parent.getRenderingHints());
		lg.scale(sx, sy);
		lg.setClip(new Rectangle2D.Float(left, top, right - left, bottom - top));
		Shape parentClip = parent.getClip();
		if (parentClip != null) {
			lg.clip(parentClip);
		}
		lg.setFont(parent.getFont());
		lg.setColor(parent.getColor());
		stack.push(new Frame(lg, layer, sx, sy));
		return count;
	}

	@Override
	public void restore() {
		if (stack.size() <= 1) {
			throw new IllegalStateException("Surface restore without matching save");
		}
		Frame frame = stack.pop();
		frame.g.dispose();
		if (frame.layer != null) {
			Graphics2D parent = top().g;
			Composite previous = parent.getComposite();
			parent.setComposite(AlphaComposite.SrcOver);
			parent.drawImage(frame.layer, AffineTransform.getScaleInstance(1D / frame.scaleX, 1D / frame.scaleY), null);
			parent.setComposite(previous);
		}
	}

	@Override
	public int getSaveCount() {
		return stack.size();
	}

	@Override
	public void restoreToCount(int saveCount) {
		if (saveCount < 1) {
			throw new IllegalArgumentException("Save count must be >= 1, got " + saveCount);
		}
		while (stack.size() > saveCount) {
			restore();
		}
	}

	@Override
	public void drawRoundRect(Rectangle2D rect, float rx, float ry, SurfacePaint paint) {
		Shape shape;
		if (rx <= 0F && ry <= 0F) {
			shape = rect;
		} else {
			// Java2D arcs are given as diameters
			shape = new RoundRectangle2D.Double(rect.getX(), rect.getY(), rect.getWidth(), rect.getHeight(),
					rx * 2D, ry * 2D);
		}
		drawShape(shape, paint);
	}

	@Override
	public void drawPath(Path2D path, SurfacePaint paint) {
		drawShape(path, paint);
	}

	@Override
	public Graphics2D graphics() {
		return top().g;
	}

	private Frame top() {
		return stack.peek();
	}

	private void drawShape(Shape shape, SurfacePaint paint) {
		Graphics2D g = (Graphics2D) top().g.create();
		try {
			g.setRenderingHint(RenderingHints.KEY_ANTIALIASING,
					paint.isAntiAlias() ? RenderingHints.VALUE_ANTIALIAS_ON : RenderingHints.VALUE_ANTIALIAS_OFF);
			g.setComposite(compositeFor(paint.getBlendMode()));

			Shape painted = shape;
			if (paint.getStyle() == SurfacePaint.Style.STROKE) {
				painted = new BasicStroke(paint.getStrokeWidth()).createStrokedShape(shape);
			}
			if (paint.getShadowLayer() != null) {
				ShadowBlur.paint(g, painted, paint.getShadowLayer(), paint.isAntiAlias());
			}
			g.setColor(paint.getColor());
			g.fill(painted);
		} finally {
			g.dispose();
		}
	}

	static Composite compositeFor(SurfacePaint.BlendMode mode) {
		switch (mode) {
		case DST_OUT:
			return AlphaComposite.DstOut;
		case SRC_OVER:
		default:
			return AlphaComposite.SrcOver;
		}
	}
}
