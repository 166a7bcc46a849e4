package com.shadowlayout.render;

/**
 * Draws the container's children onto the surface's active layer.
 */
@FunctionalInterface
public interface ChildPainter {
	void paint(DrawSurface surface);
}
