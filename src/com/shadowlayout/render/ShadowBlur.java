package com.shadowlayout.render;

import static com.shadowlayout.constants.ShadowDefaults.BLUR_SIGMA_BIAS;
import static com.shadowlayout.constants.ShadowDefaults.BLUR_SIGMA_SCALE;

import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.Shape;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;

/**
 * Rasterizes the shadow of a shape: the shape filled in the shadow colour,
 * blurred with a separable Gaussian and drawn at the shadow offset.
 */
final class ShadowBlur {

	private ShadowBlur() {
	}

	static float sigmaFor(float radius) {
		return radius * BLUR_SIGMA_SCALE + BLUR_SIGMA_BIAS;
	}

	/**
	 * Paints the shadow of {@code shape} onto {@code g}. Nothing is drawn for an
	 * invisible shadow or an empty shape.
	 */
	static void paint(Graphics2D g, Shape shape, ShadowLayer shadow, boolean antiAlias) {
		if (!shadow.isVisible()) {
			return;
		}
		Rectangle bounds = shape.getBounds();
		if (bounds.isEmpty()) {
			return;
		}
		float sigma = sigmaFor(shadow.getRadius());
		int kernelRadius = (int) Math.ceil(sigma * 3F);
		// ConvolveOp leaves a kernel-wide rim untouched, keep the blur tail clear of it
		int pad = kernelRadius * 2;

		BufferedImage mask = new BufferedImage(bounds.width + pad * 2, bounds.height + pad * 2,
				BufferedImage.TYPE_INT_ARGB);
		Graphics2D mg = mask.createGraphics();
		try {
			mg.setRenderingHint(RenderingHints.KEY_ANTIALIASING,
					antiAlias ? RenderingHints.VALUE_ANTIALIAS_ON : RenderingHints.VALUE_ANTIALIAS_OFF);
			mg.translate(pad - bounds.x, pad - bounds.y);
			mg.setColor(shadow.getColor());
			mg.fill(shape);
		} finally {
			mg.dispose();
		}

		float[] weights = gaussian(kernelRadius, sigma);
		ConvolveOp horizontal = new ConvolveOp(new Kernel(weights.length, 1, weights), ConvolveOp.EDGE_NO_OP, null);
		ConvolveOp vertical = new ConvolveOp(new Kernel(1, weights.length, weights), ConvolveOp.EDGE_NO_OP, null);
		BufferedImage blurred = vertical.filter(horizontal.filter(mask, null), null);

		AffineTransform at = AffineTransform.getTranslateInstance(
				bounds.x - pad + shadow.getDx(),
				bounds.y - pad + shadow.getDy());
		g.drawImage(blurred, at, null);
	}

	static float[] gaussian(int radius, float sigma) {
		float[] weights = new float[radius * 2 + 1];
		float twoSigmaSquare = 2F * sigma * sigma;
		float total = 0F;
		for (int i = -radius; i <= radius; i++) {
			float w = (float) Math.exp(-(i * i) / twoSigmaSquare);
			weights[i + radius] = w;
			total += w;
		}
		for (int i = 0; i < weights.length; i++) {
			weights[i] /= total;
		}
		return weights;
	}
}
