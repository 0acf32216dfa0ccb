/*-
 * #%L
 * Robust background phase correction for phase-contrast MRI
 * velocity data using polynomial MSAC fits.
 * %%
 * Copyright (C) 2021 - 2025 Phase Background Correction developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.phasecorr.process.fit;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Random;

import org.junit.Test;

public class PolynomialBasisTest {

	private static final int[] NUM_COEFFICIENTS_2D = {1, 3, 6, 10};
	private static final int[] NUM_COEFFICIENTS_3D = {1, 4, 10, 20};

	@Test
	public void testNumCoefficients() {

		final Random rnd = new Random(42);
		for (final int numPoints : new int[] {1, 7, 50}) {
			for (int degree = 0; degree <= 3; ++degree) {
				final PolynomialOrder order = PolynomialOrder.fromDegree(degree);

				final DesignMatrix design2d = DesignMatrix.create(PolynomialBasis.create(order, 2), randomPoints(rnd, numPoints, 1, 2));
				assertEquals(NUM_COEFFICIENTS_2D[degree], design2d.numColumns());
				assertEquals(numPoints, design2d.numRows());
				assertEquals(NUM_COEFFICIENTS_2D[degree], design2d.row(0).length);

				final DesignMatrix design3d = DesignMatrix.create(PolynomialBasis.create(order, 3), randomPoints(rnd, numPoints, 3, 3));
				assertEquals(NUM_COEFFICIENTS_3D[degree], design3d.numColumns());
				assertEquals(numPoints, design3d.numRows());
				assertEquals(NUM_COEFFICIENTS_3D[degree], order.numCoefficients(3));
			}
		}
	}

	@Test
	public void testColumnOrder2D() {

		final PointSet points = new PointSet(new double[][] {{0}}, new double[][] {{2}, {3}});
		final DesignMatrix design = DesignMatrix.create(new PolynomialBasis2D(PolynomialOrder.CUBIC), points);
		assertArrayEquals(new double[] {1, 2, 3, 4, 6, 9, 8, 12, 27, 18}, design.row(0), 0);
	}

	@Test
	public void testColumnOrder3D() {

		final PointSet points = new PointSet(new double[][] {{0}, {0}, {0}}, new double[][] {{2}, {3}, {5}});
		final DesignMatrix design = DesignMatrix.create(new PolynomialBasis3D(PolynomialOrder.CUBIC), points);
		assertArrayEquals(
				new double[] {1, 2, 3, 5, 4, 6, 10, 9, 15, 25, 8, 12, 20, 27, 18, 45, 125, 50, 75, 30},
				design.row(0), 0);
	}

	@Test
	public void testLowerOrdersArePrefixes() {

		final Random rnd = new Random(7);
		for (final int n : new int[] {2, 3}) {
			final PointSet points = randomPoints(rnd, 5, 1, n);
			final DesignMatrix cubic = DesignMatrix.create(PolynomialBasis.create(PolynomialOrder.CUBIC, n), points);
			for (int degree = 0; degree < 3; ++degree) {
				final DesignMatrix lower = DesignMatrix.create(PolynomialBasis.create(PolynomialOrder.fromDegree(degree), n), points);
				for (int i = 0; i < points.size(); ++i)
					for (int k = 0; k < lower.numColumns(); ++k)
						assertEquals(cubic.row(i)[k], lower.row(i)[k], 0);
			}
		}
	}

	@Test(expected = InvalidConfigurationException.class)
	public void testOrderTooHigh() {
		PolynomialOrder.fromDegree(4);
	}

	@Test(expected = InvalidConfigurationException.class)
	public void testNegativeOrder() {
		PolynomialOrder.fromDegree(-1);
	}

	@Test(expected = InvalidConfigurationException.class)
	public void testUnsupportedDimensionality() {
		PolynomialBasis.create(PolynomialOrder.LINEAR, 4);
	}

	@Test(expected = InvalidConfigurationException.class)
	public void testUnsupportedFlowDimensions() {
		FlowEncoding.fromFlowDimensions(2);
	}

	@Test(expected = DimensionMismatchException.class)
	public void testBasisDimensionMismatch() {
		DesignMatrix.create(new PolynomialBasis3D(PolynomialOrder.LINEAR), randomPoints(new Random(1), 4, 1, 2));
	}

	static PointSet randomPoints(final Random rnd, final int numPoints, final int numChannels, final int numDimensions) {
		final double[][] targets = new double[numChannels][numPoints];
		final double[][] coordinates = new double[numDimensions][numPoints];
		for (int i = 0; i < numPoints; ++i) {
			for (int c = 0; c < numChannels; ++c)
				targets[c][i] = rnd.nextDouble() * 2 - 1;
			for (int d = 0; d < numDimensions; ++d)
				coordinates[d][i] = rnd.nextInt(32);
		}
		return new PointSet(targets, coordinates);
	}
}
