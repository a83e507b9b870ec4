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
 * Plane in world space, represented by the equation ax + by + cz + d = 0 with a normalized (a, b, c).
 *
 * @author hal.hildebrand
 */
public record Plane3D(float a, float b, float c, float d) {

    private static final float PARALLEL_EPSILON = 1e-6f;

    /**
     * Create a plane from a point and a normal vector
     *
     * @param point  point on the plane
     * @param normal normal vector to the plane (will be normalized)
     * @return the plane
     */
    public static Plane3D fromPointAndNormal(Point3f point, Vector3f normal) {
        if (normal.length() < 1e-6f) {
            throw new IllegalArgumentException("Normal vector cannot be zero");
        }
        var n = new Vector3f(normal);
        n.normalize();
        float d = -(n.x * point.x + n.y * point.y + n.z * point.z);
        return new Plane3D(n.x, n.y, n.z, d);
    }

    /**
     * Create the horizontal plane y = height with an upward normal
     */
    public static Plane3D horizontal(float height) {
        return new Plane3D(0, 1, 0, -height);
    }

    /**
     * Calculate the signed distance from a point to this plane. Positive distance means the point is on the side of
     * the plane in the direction of the normal
     */
    public float distanceToPoint(Point3f point) {
        return a * point.x + b * point.y + c * point.z + d;
    }

    public Vector3f getNormal() {
        return new Vector3f(a, b, c);
    }

    /**
     * Distance along the ray to its intersection with this plane.
     *
     * @return the ray parameter of the hit, empty when the ray is parallel, points away, or the hit is out of range
     */
    public Optional<Float> intersectionDistance(Ray3D ray) {
        var dir = ray.direction();
        float denom = a * dir.x + b * dir.y + c * dir.z;
        if (Math.abs(denom) < PARALLEL_EPSILON) {
            return Optional.empty();
        }
        float t = -distanceToPoint(ray.origin()) / denom;
        if (t < 0 || !ray.isWithinDistance(t)) {
            return Optional.empty();
        }
        return Optional.of(t);
    }
}
