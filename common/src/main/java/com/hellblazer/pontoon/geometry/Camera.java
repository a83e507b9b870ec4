/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Pontoon Configurator.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.pontoon.geometry;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;

/**
 * Immutable look-at camera used to turn pointer positions into world-space picking rays. Value equality makes a
 * camera usable as part of a cache key: two cameras that are equal always produce the same ray for the same pixel.
 *
 * @param projection  perspective or orthographic
 * @param position    eye position in world space
 * @param target      point the camera looks at
 * @param up          approximate up direction, must not be parallel to the view direction
 * @param fovY        vertical field of view in radians (perspective only)
 * @param halfHeight  half of the visible world height (orthographic only)
 * @author hal.hildebrand
 */
public record Camera(Projection projection, Point3f position, Point3f target, Vector3f up, float fovY,
                     float halfHeight) {

    public enum Projection {
        PERSPECTIVE, ORTHOGRAPHIC
    }

    public Camera {
        if (projection == null) {
            throw new IllegalArgumentException("Projection cannot be null");
        }
        position = new Point3f(position);
        target = new Point3f(target);
        up = new Vector3f(up);
        if (position.equals(target)) {
            throw new IllegalArgumentException("Camera position and target must differ: " + position);
        }
        if (projection == Projection.PERSPECTIVE && (fovY <= 0 || fovY >= Math.PI)) {
            throw new IllegalArgumentException("Field of view must be between 0 and pi radians: " + fovY);
        }
        if (projection == Projection.ORTHOGRAPHIC && halfHeight <= 0) {
            throw new IllegalArgumentException("Orthographic half height must be positive: " + halfHeight);
        }
        var forward = new Vector3f(target.x - position.x, target.y - position.y, target.z - position.z);
        var right = new Vector3f();
        right.cross(forward, up);
        if (right.lengthSquared() < 1e-12f) {
            throw new IllegalArgumentException("Up vector is parallel to the view direction: " + up);
        }
    }

    public static Camera perspective(Point3f position, Point3f target, Vector3f up, float fovY) {
        return new Camera(Projection.PERSPECTIVE, position, target, up, fovY, 0);
    }

    public static Camera orthographic(Point3f position, Point3f target, Vector3f up, float halfHeight) {
        return new Camera(Projection.ORTHOGRAPHIC, position, target, up, 0, halfHeight);
    }

    @Override
    public Point3f position() {
        return new Point3f(position);
    }

    @Override
    public Point3f target() {
        return new Point3f(target);
    }

    @Override
    public Vector3f up() {
        return new Vector3f(up);
    }

    /**
     * Cast a ray through a point given in normalized device coordinates
     *
     * @param ndcX        horizontal NDC in [-1, 1]
     * @param ndcY        vertical NDC in [-1, 1], up positive
     * @param aspectRatio viewport width / height
     * @return the picking ray
     */
    public Ray3D rayThrough(float ndcX, float ndcY, float aspectRatio) {
        // Camera coordinate system, as for frustum construction
        var forward = new Vector3f(target.x - position.x, target.y - position.y, target.z - position.z);
        forward.normalize();

        var upNorm = new Vector3f(up);
        upNorm.normalize();

        var right = new Vector3f();
        right.cross(forward, upNorm);
        right.normalize();

        var actualUp = new Vector3f();
        actualUp.cross(right, forward);
        actualUp.normalize();

        if (projection == Projection.ORTHOGRAPHIC) {
            float halfWidth = halfHeight * aspectRatio;
            var origin = new Point3f(position);
            origin.scaleAdd(ndcX * halfWidth, right, origin);
            origin.scaleAdd(ndcY * halfHeight, actualUp, origin);
            return new Ray3D(origin, forward);
        }

        float tanHalf = (float) Math.tan(fovY / 2.0f);
        var direction = new Vector3f(forward);
        direction.scaleAdd(ndcX * tanHalf * aspectRatio, right, direction);
        direction.scaleAdd(ndcY * tanHalf, actualUp, direction);
        return new Ray3D(position, direction);
    }
}
