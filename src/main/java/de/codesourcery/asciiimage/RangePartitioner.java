/**
 * Copyright 2015 Tobias Gierke <tobias.gierke@code-sourcery.de>
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.codesourcery.asciiimage;

/**
 * Splits one axis of the source image into spans, one for each output cell.
 * 
 * A cursor advances by <code>ratio</code> source pixels per output cell and each span
 * runs from the (truncated) cursor position before the step to the one after it. Since every span starts
 * exactly where its predecessor ended, there are no gaps or overlaps and the last span ends
 * at <code>floor(ratio * targetLength)</code>. When upscaling (<code>ratio &lt; 1</code>) some
 * steps don't cross a pixel boundary and yield empty spans.
 *
 * @author tobias.gierke@code-sourcery.de
 */
public final class RangePartitioner
{
    private RangePartitioner() {
    }

    /**
     * Partitions an axis.
     * 
     * @param targetLength number of output cells, may be 0
     * @param ratio source pixels per output cell
     * @return partition with exactly <code>targetLength</code> spans
     */
    public static AxisPartition partition(int targetLength,double ratio) 
    {
        if ( targetLength < 0 ) {
            throw new IllegalArgumentException("Target length must be >= 0 but was "+targetLength);
        }
        if ( targetLength == 0 ) {
            return AxisPartition.EMPTY;
        }
        if ( ! ( ratio > 0 ) || Double.isInfinite( ratio ) ) {
            throw new IllegalArgumentException("Ratio must be a positive number but was "+ratio);
        }
        final Span[] spans = new Span[ targetLength ];
        int previous = 0;
        for ( int i = 0 ; i < targetLength ; i++ ) 
        {
            // cursor position after i+1 steps, multiplied rather than summed up so that rounding errors don't accumulate
            final int next = (int) Math.floor( ratio * (i+1) );
            spans[i] = new Span( previous , next );
            previous = next;
        }
        return new AxisPartition( spans );
    }

    /**
     * Partitions an axis of <code>sourceLength</code> pixels into <code>targetLength</code> cells.
     * 
     * Boundaries are calculated in integer arithmetic, the last span always ends at <code>sourceLength</code>.
     * 
     * @param targetLength number of output cells, may be 0
     * @param sourceLength number of source pixels, may be 0
     * @return partition with exactly <code>targetLength</code> spans
     */
    public static AxisPartition partition(int targetLength,int sourceLength) 
    {
        if ( targetLength < 0 || sourceLength < 0 ) {
            throw new IllegalArgumentException("Lengths must be >= 0 but were "+targetLength+" (target) and "+sourceLength+" (source)");
        }
        if ( targetLength == 0 ) {
            return AxisPartition.EMPTY;
        }
        final Span[] spans = new Span[ targetLength ];
        int previous = 0;
        for ( int i = 0 ; i < targetLength ; i++ ) 
        {
            // floor( (i+1) * sourceLength / targetLength )
            final int next = (int) ( (long) (i+1) * sourceLength / targetLength );
            spans[i] = new Span( previous , next );
            previous = next;
        }
        return new AxisPartition( spans );
    }
}
