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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;

import net.imglib2.util.RealSum;

/**
 * Polynomial background of a given order, fitted independently for every flow
 * channel. Order 0 is the mean of the selected targets, higher orders are
 * least-squares solutions computed by QR decomposition.
 */
public class PolynomialBackgroundFit implements BackgroundFit
{
	/**
	 * Diagonal entries of R below this fraction of the largest one are
	 * considered zero.
	 */
	public static final double RANK_TOLERANCE = 1e-10;

	private final FlowEncoding encoding;

	private final PolynomialBasis basis;

	public PolynomialBackgroundFit( final FlowEncoding encoding, final PolynomialOrder order )
	{
		this.encoding = encoding;
		this.basis = PolynomialBasis.create( order, encoding.numSpatialDimensions() );
	}

	public static PolynomialBackgroundFit create( final FlowEncoding encoding, final int order )
	{
		return new PolynomialBackgroundFit( encoding, PolynomialOrder.fromDegree( order ) );
	}

	@Override
	public FlowEncoding encoding()
	{
		return encoding;
	}

	@Override
	public PolynomialOrder order()
	{
		return basis.order();
	}

	@Override
	public int getMinNumPoints()
	{
		return basis.numCoefficients();
	}

	public PolynomialBasis basis()
	{
		return basis;
	}

	@Override
	public DesignMatrix designMatrix( final PointSet points )
	{
		return DesignMatrix.create( basis, points );
	}

	@Override
	public PolynomialModel fit( final PointSet points ) throws FitException
	{
		return fit( points, InlierMask.all( encoding.numChannels(), points.size() ) );
	}

	@Override
	public PolynomialModel fit( final PointSet points, final InlierMask inliers ) throws FitException
	{
		checkChannels( points );
		if ( inliers.numChannels() != encoding.numChannels() || inliers.size() != points.size() )
			throw new DimensionMismatchException( "Inlier mask (" + inliers.numChannels() + " x " + inliers.size() + ") does not match points (" + points.numChannels() + " x " + points.size() + ")." );

		final int numCoefficients = basis.numCoefficients();
		for ( int c = 0; c < encoding.numChannels(); ++c )
		{
			final int numSelected = inliers.count( c );
			if ( numSelected < numCoefficients )
				throw new InsufficientSamplesException( numSelected, numCoefficients );
		}

		final double[][] coefficients = new double[ encoding.numChannels() ][];
		if ( basis.order() == PolynomialOrder.CONSTANT )
		{
			for ( int c = 0; c < coefficients.length; ++c )
				coefficients[ c ] = new double[] { mean( points.targets()[ c ], inliers, c ) };
		}
		else
		{
			final DesignMatrix design = designMatrix( points );
			for ( int c = 0; c < coefficients.length; ++c )
				coefficients[ c ] = solveLeastSquares( design, points.targets()[ c ], inliers, c );
		}

		for ( final double[] channel : coefficients )
			for ( final double v : channel )
				if ( !Double.isFinite( v ) )
					throw new SingularDesignException( "Fit produced non-finite coefficients." );

		return new PolynomialModel( basis.order(), basis.numSpatialDimensions(), coefficients );
	}

	@Override
	public double[][] evaluate( final PolynomialModel model, final PointSet points )
	{
		return evaluate( model, designMatrix( points ) );
	}

	@Override
	public double[][] evaluate( final PolynomialModel model, final DesignMatrix design )
	{
		checkModel( model );
		final double[][] estimates = new double[ model.numChannels() ][];
		for ( int c = 0; c < estimates.length; ++c )
			estimates[ c ] = design.multiply( model.coefficientsRef( c ) );
		return estimates;
	}

	@Override
	public double[][] distance( final PolynomialModel model, final PointSet points )
	{
		return distance( model, points, designMatrix( points ) );
	}

	@Override
	public double[][] distance( final PolynomialModel model, final PointSet points, final DesignMatrix design )
	{
		checkChannels( points );
		if ( design.numRows() != points.size() )
			throw new DimensionMismatchException( "Design matrix has " + design.numRows() + " rows for " + points.size() + " points." );

		final double[][] distances = evaluate( model, design );
		final double[][] targets = points.targets();
		for ( int c = 0; c < distances.length; ++c )
		{
			final double[] d = distances[ c ];
			final double[] t = targets[ c ];
			for ( int i = 0; i < d.length; ++i )
				d[ i ] = Math.abs( ( t[ i ] - d[ i ] ) / 2 );
		}
		return distances;
	}

	private static double mean( final double[] targets, final InlierMask inliers, final int channel )
	{
		final RealSum sum = new RealSum();
		int n = 0;
		for ( int i = 0; i < targets.length; ++i )
		{
			if ( inliers.isInlier( channel, i ) )
			{
				sum.add( targets[ i ] );
				++n;
			}
		}
		return sum.getSum() / n;
	}

	private static double[] solveLeastSquares(
			final DesignMatrix design,
			final double[] targets,
			final InlierMask inliers,
			final int channel ) throws SingularDesignException
	{
		final int numSelected = inliers.count( channel );
		final double[][] a = new double[ numSelected ][];
		final double[] b = new double[ numSelected ];
		for ( int i = 0, j = 0; i < targets.length; ++i )
		{
			if ( inliers.isInlier( channel, i ) )
			{
				a[ j ] = design.row( i );
				b[ j ] = targets[ i ];
				++j;
			}
		}

		final QRDecomposition qr = new QRDecomposition( new Array2DRowRealMatrix( a, false ) );
		final RealMatrix r = qr.getR();
		final int numColumns = design.numColumns();

		double maxDiagonal = 0;
		for ( int k = 0; k < numColumns; ++k )
			maxDiagonal = Math.max( maxDiagonal, Math.abs( r.getEntry( k, k ) ) );

		for ( int k = 0; k < numColumns; ++k )
			if ( !( Math.abs( r.getEntry( k, k ) ) > maxDiagonal * RANK_TOLERANCE ) )
				throw new SingularDesignException( "Design matrix of " + numSelected + " points is rank deficient (column " + k + ")." );

		try
		{
			return qr.getSolver().solve( new ArrayRealVector( b, false ) ).toArray();
		}
		catch ( final SingularMatrixException e )
		{
			throw new SingularDesignException( "Least-squares solve failed for " + numSelected + " points.", e );
		}
	}

	private void checkChannels( final PointSet points )
	{
		if ( points.numChannels() != encoding.numChannels() )
			throw new DimensionMismatchException( "Points have " + points.numChannels() + " channels, " + encoding + " requires " + encoding.numChannels() + "." );
		if ( points.numSpatialDimensions() != encoding.numSpatialDimensions() )
			throw new DimensionMismatchException( "Points have " + points.numSpatialDimensions() + " spatial dimensions, " + encoding + " requires " + encoding.numSpatialDimensions() + "." );
	}

	private void checkModel( final PolynomialModel model )
	{
		if ( model.order() != basis.order() || model.numSpatialDimensions() != basis.numSpatialDimensions() )
			throw new IllegalArgumentException( "Model of order " + model.order().degree() + " in " + model.numSpatialDimensions() + "d cannot be evaluated with a basis of order " + basis.order().degree() + " in " + basis.numSpatialDimensions() + "d." );
		if ( model.numChannels() != encoding.numChannels() )
			throw new DimensionMismatchException( "Model has " + model.numChannels() + " channels, " + encoding + " requires " + encoding.numChannels() + "." );
	}
}
