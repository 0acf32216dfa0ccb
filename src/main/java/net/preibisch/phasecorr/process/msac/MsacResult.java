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
package net.preibisch.phasecorr.process.msac;

import net.preibisch.phasecorr.process.fit.InlierMask;

/**
 * Outcome of an {@link MsacEstimator} run: the lowest truncated cost found per
 * channel and the inlier set of the trial that achieved it.
 */
public class MsacResult
{
	private final double initialCost;

	private final double[] bestCost;

	private final InlierMask inliers;

	private final double[][] costHistory;

	private final int numDegenerateTrials;

	MsacResult(
			final double initialCost,
			final double[] bestCost,
			final InlierMask inliers,
			final double[][] costHistory,
			final int numDegenerateTrials )
	{
		this.initialCost = initialCost;
		this.bestCost = bestCost;
		this.inliers = inliers;
		this.costHistory = costHistory;
		this.numDegenerateTrials = numDegenerateTrials;
	}

	/**
	 * @return {@code threshold * N}, the cost every channel starts with
	 */
	public double initialCost()
	{
		return initialCost;
	}

	public double[] bestCost()
	{
		return bestCost.clone();
	}

	public double bestCost( final int channel )
	{
		return bestCost[ channel ];
	}

	public InlierMask inliers()
	{
		return inliers;
	}

	public int numTrials()
	{
		return costHistory.length;
	}

	/**
	 * @param trial trial index
	 * @return best cost per channel after {@code trial} has been merged
	 */
	public double[] bestCostAfter( final int trial )
	{
		return costHistory[ trial ].clone();
	}

	/**
	 * @return number of trials whose sample could not define a model
	 */
	public int numDegenerateTrials()
	{
		return numDegenerateTrials;
	}
}
