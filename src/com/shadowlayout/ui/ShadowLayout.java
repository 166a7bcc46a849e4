package com.shadowlayout.ui;

import java.awt.BorderLayout;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.Insets;
import java.awt.LayoutManager;
import java.util.Objects;
import java.util.logging.Logger;

import javax.swing.JPanel;

import com.shadowlayout.config.ShadowConfig;
import com.shadowlayout.geometry.ContentGeometry;
import com.shadowlayout.geometry.GeometryResolver;
import com.shadowlayout.geometry.PaddingPolicy;
import com.shadowlayout.render.Graphics2DSurface;
import com.shadowlayout.render.RenderPipeline;
import com.shadowlayout.util.LoggerSetup;

/**
 * Container that paints a soft shadow behind its children, rounds the corners
 * of whatever the children draw, and optionally strokes a rounded border.
 *
 * The shadow needs room outside the content area, so the panel installs a
 * {@link ShadowPaddingBorder} sized from the configuration. Replacing that
 * border with {@link #setBorder} removes the reserved space.
 *
 * Children are painted into an off-screen software layer so the corner mask
 * (DST_OUT) only erases their pixels. The panel itself is not opaque.
 */
public class ShadowLayout extends JPanel {
	private static final long serialVersionUID = 1L;
	private static final Logger logger = LoggerSetup.getLogger(ShadowLayout.class);

	private final ShadowPaddingBorder paddingBorder = new ShadowPaddingBorder();
	private final transient RenderPipeline pipeline = new RenderPipeline();
	private ShadowConfig config;
	private ContentGeometry geometry = ContentGeometry.UNRESOLVED;

	public ShadowLayout() {
		this(ShadowConfig.defaults());
	}

	public ShadowLayout(ShadowConfig config) {
		this(config, new BorderLayout());
	}

	public ShadowLayout(ShadowConfig config, LayoutManager layout) {
		super(layout);
		this.config = Objects.requireNonNull(config, "config");
		setOpaque(false);
		setBorder(paddingBorder);
		processPadding();
	}

	public ShadowConfig getShadowConfig() {
		return config;
	}

	/**
	 * Applies a new configuration: padding is recomputed, geometry is resolved
	 * again for the current size, and the panel is laid out and repainted.
	 */
	public void setShadowConfig(ShadowConfig config) {
		this.config = Objects.requireNonNull(config, "config");
		processPadding();
		if (geometry.isResolved()) {
			onSizeChanged(getWidth(), getHeight());
		}
		revalidate();
		repaint();
	}

	public ContentGeometry getContentGeometry() {
		return geometry;
	}

	private void processPadding() {
		Insets padding = PaddingPolicy.computeInsets(config);
		paddingBorder.setInsets(padding);
		logger.fine("Shadow padding " + padding + " for " + config);
	}

	// Every setSize/resize/setBounds variant ends up here
	@Override
	public void setBounds(int x, int y, int width, int height) {
		boolean resized = width != getWidth() || height != getHeight() || !geometry.isResolved();
		super.setBounds(x, y, width, height);
		if (resized) {
			onSizeChanged(getWidth(), getHeight());
		}
	}

	private void onSizeChanged(int width, int height) {
		geometry = GeometryResolver.onResize(Math.max(0, width), Math.max(0, height), getInsets(),
				config.getBorderWidth());
	}

	// A child repaint must start here, or it would skip the corner mask and border
	@Override
	protected boolean isPaintingOrigin() {
		return true;
	}

	@Override
	protected void paintChildren(Graphics g) {
		if (!(g instanceof Graphics2D)) {
			logger.fine("Not a Graphics2D, frame skipped");
			return;
		}
		Graphics2DSurface surface = new Graphics2DSurface((Graphics2D) g, getWidth(), getHeight());
		pipeline.draw(surface, geometry, config, s -> super.paintChildren(s.graphics()));
	}
}
