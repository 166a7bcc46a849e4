package com.shadowlayout.render;

import java.awt.Graphics2D;
import java.awt.geom.Path2D;
import java.awt.geom.Rectangle2D;

/**
 * Minimal 2D drawing surface the render pipeline needs.
 *
 * The surface keeps a stack of saved states. {@link #save()} scopes clip and
 * transform changes; {@link #saveLayer} additionally redirects drawing into an
 * off-screen buffer that is composited onto the layer below by the matching
 * {@link #restore()}. Blend modes such as
 * {@link SurfacePaint.BlendMode#DST_OUT} therefore only touch the pixels of the
 * current layer.
 */
public interface DrawSurface {

	int getWidth();

	int getHeight();

	/**
	 * @return the save count before this call, for {@link #restoreToCount(int)}
	 */
	int save();

	/**
	 * Opens a transparent layer clipped to the given bounds.
	 *
	 * @return the save count before this call
	 */
	int saveLayer(float left, float top, float right, float bottom);

	/**
	 * Pops the most recent save or layer, compositing a layer onto the one below.
	 *
	 * @throws IllegalStateException if nothing is left to restore
	 */
	void restore();

	/** Starts at 1 for a fresh surface. */
	int getSaveCount();

	/** Restores until {@link #getSaveCount()} equals {@code saveCount}. */
	void restoreToCount(int saveCount);

	/**
	 * Draws a rounded rectangle whose corners have radii {@code rx} and {@code ry}.
	 */
	void drawRoundRect(Rectangle2D rect, float rx, float ry, SurfacePaint paint);

	/**
	 * Draws a path using the path's own winding rule.
	 */
	void drawPath(Path2D path, SurfacePaint paint);

	/**
	 * Graphics of the active layer, for painters that only know {@code Graphics2D}.
	 * State changes made to it last until the enclosing save is restored.
	 */
	Graphics2D graphics();
}
