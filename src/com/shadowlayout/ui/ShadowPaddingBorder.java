package com.shadowlayout.ui;

import java.awt.Component;
import java.awt.Insets;

import javax.swing.border.AbstractBorder;

/**
 * Empty border that reserves the space a shadow spreads into. The shadow
 * itself is painted by {@link ShadowLayout}.
 */
public class ShadowPaddingBorder extends AbstractBorder {
	private static final long serialVersionUID = 1L;

	private final Insets insets = new Insets(0, 0, 0, 0);

	public void setInsets(Insets padding) {
		insets.set(padding.top, padding.left, padding.bottom, padding.right);
	}

	@Override
	public Insets getBorderInsets(Component c) {
		return new Insets(insets.top, insets.left, insets.bottom, insets.right);
	}

	@Override
	public Insets getBorderInsets(Component c, Insets target) {
		target.set(insets.top, insets.left, insets.bottom, insets.right);
		return target;
	}

	@Override
	public boolean isBorderOpaque() {
		return false;
	}
}
