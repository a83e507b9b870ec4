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

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class Ray3DTest {

    private static final float EPSILON = 1e-5f;

    @Test
    public void testDirectionNormalization() {
        var ray = new Ray3D(new Point3f(1, 2, 3), new Vector3f(3, 4, 0));

        assertEquals(0.6f, ray.direction().x, EPSILON);
        assertEquals(0.8f, ray.direction().y, EPSILON);
        assertEquals(0.0f, ray.direction().z, EPSILON);
        assertEquals(1.0f, ray.direction().length(), EPSILON);
    }

    @Test
    public void testNegativeOriginAllowed() {
        var ray = new Ray3D(new Point3f(-4, -1, -2), new Vector3f(0, 1, 0));
        assertEquals(-4f, ray.origin().x, EPSILON);
        assertTrue(ray.isUnbounded());
    }

    @Test
    public void testAccessorsReturnCopies() {
        var origin = new Point3f(1, 2, 3);
        var ray = new Ray3D(origin, new Vector3f(0, 0, 1));
        origin.x = 99;
        ray.origin().x = 42;
        ray.direction().x = 7;

        assertEquals(1f, ray.origin().x, EPSILON);
        assertEquals(0f, ray.direction().x, EPSILON);
        assertEquals(1f, ray.direction().length(), EPSILON);
        assertEquals(4f, ray.getPointAt(1).z, EPSILON);
    }

    @Test
    public void testZeroDirectionThrows() {
        assertThrows(IllegalArgumentException.class, () -> new Ray3D(new Point3f(), new Vector3f()));
    }

    @Test
    public void testNegativeMaxDistanceThrows() {
        assertThrows(IllegalArgumentException.class,
                     () -> new Ray3D(new Point3f(), new Vector3f(1, 0, 0), -5.0f));
    }

    @Test
    public void testGetPointAt() {
        var ray = new Ray3D(new Point3f(1, 2, 3), new Vector3f(1, 0, 0));
        var p5 = ray.getPointAt(5);
        assertEquals(6.0f, p5.x, EPSILON);
        assertEquals(2.0f, p5.y, EPSILON);
        assertEquals(3.0f, p5.z, EPSILON);
    }

    @Test
    public void testOriginIsCopied() {
        var origin = new Point3f(1, 1, 1);
        var ray = new Ray3D(origin, new Vector3f(0, 0, 1));
        origin.x = 100;
        assertEquals(1f, ray.origin().x, EPSILON);
    }

    @Test
    public void testIntersectHorizontalPlane() {
        var ray = Ray3D.fromPointsUnbounded(new Point3f(0, 10, 0), new Point3f(1, 9, 0));
        var hit = ray.intersect(Plane3D.horizontal(0));

        assertTrue(hit.isPresent());
        assertEquals(10f, hit.get().x, 1e-4f);
        assertEquals(0f, hit.get().y, 1e-4f);
    }

    @Test
    public void testIntersectBeyondMaxDistance() {
        var ray = new Ray3D(new Point3f(0, 10, 0), new Vector3f(0, -1, 0), 5f);
        assertTrue(ray.intersect(Plane3D.horizontal(0)).isEmpty());
        assertTrue(ray.intersect(Plane3D.horizontal(6)).isPresent());
    }
}
