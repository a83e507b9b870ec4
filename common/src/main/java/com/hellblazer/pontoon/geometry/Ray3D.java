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
import java.util.Optional;

/**
 * A ray in world space. Unlike index-space rays, world rays may start anywhere, including below the water plane, so
 * no coordinate restriction is applied to the origin.
 *
 * @param origin      the starting point of the ray
 * @param direction   the direction vector (normalized on construction)
 * @param maxDistance the maximum distance along the ray, or {@link #UNBOUNDED}
 * @author hal.hildebrand
 */
public record Ray3D(Point3f origin, Vector3f direction, float maxDistance) {

    public static final float UNBOUNDED = Float.POSITIVE_INFINITY;

    public Ray3D {
        if (maxDistance <= 0 && maxDistance != UNBOUNDED) {
            throw new IllegalArgumentException("Ray max distance must be positive or unbounded: " + maxDistance);
        }
        origin = new Point3f(origin);
        direction = new Vector3f(direction);
        if (direction.lengthSquared() == 0) {
            throw new IllegalArgumentException("Ray direction cannot be zero vector");
        }
        direction.normalize();
    }

    /**
     * Create an unbounded ray
     *
     * @param origin    the starting point of the ray
     * @param direction the direction vector
     */
    public Ray3D(Point3f origin, Vector3f direction) {
        this(origin, direction, UNBOUNDED);
    }

    /**
     * Create an unbounded ray from origin pointing towards target
     */
    public static Ray3D fromPointsUnbounded(Point3f origin, Point3f target) {
        var direction = new Vector3f(target.x - origin.x, target.y - origin.y, target.z - origin.z);
        return new Ray3D(origin, direction, UNBOUNDED);
    }

    @Override
    public Point3f origin() {
        return new Point3f(origin);
    }

    @Override
    public Vector3f direction() {
        return new Vector3f(direction);
    }

    /**
     * Get a point along the ray at parameter t
     *
     * @param t the parameter (t >= 0 for points along the ray from origin)
     * @return the point at origin + t * direction
     */
    public Point3f getPointAt(float t) {
        return new Point3f(origin.x + t * direction.x, origin.y + t * direction.y, origin.z + t * direction.z);
    }

    /**
     * Intersect this ray with a plane.
     *
     * @param plane the plane to intersect
     * @return the intersection point, or empty if the ray is parallel to the plane, points away from it, or the hit
     * lies beyond the max distance
     */
    public Optional<Point3f> intersect(Plane3D plane) {
        return plane.intersectionDistance(this).map(this::getPointAt);
    }

    public boolean isUnbounded() {
        return maxDistance == UNBOUNDED;
    }

    /**
     * Check if a distance is within the ray's maximum distance
     */
    public boolean isWithinDistance(float distance) {
        return distance <= maxDistance;
    }
}
