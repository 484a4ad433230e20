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
 * Resamples a grayscale image to an arbitrary output size using a box filter.
 * 
 * Both axes of the source image are split into one span per output row/column (see {@link RangePartitioner})
 * and each output cell gets the truncated average of all source samples inside its row span 
 * and column span. Cells whose spans are empty (this happens when upscaling) become 0.
 *
 * @author tobias.gierke@code-sourcery.de
 */
public final class BoxResampler
{
    /**
     * Largest number of output cells a grid can hold.
     */
    public static final int MAX_CELLS = Integer.MAX_VALUE - 8;

    private BoxResampler() {
    }

    /**
     * Converts an RGBA image to grayscale and resamples it.
     * 
     * @see #resample(GrayscaleBuffer, int, int)
     */
    public static OutputGrid resample(SourceImage image,int targetWidth,int targetHeight) 
    {
        return resample( GrayscaleReducer.reduce( image ) , targetWidth , targetHeight );
    }

    /**
     * Resamples a grayscale image.
     * 
     * @param gray image to resample
     * @param targetWidth output width in cells, 0 yields an empty grid
     * @param targetHeight output height in cells, 0 yields an empty grid
     * @return grid of <code>targetWidth x targetHeight</code> cells
     */
    public static OutputGrid resample(GrayscaleBuffer gray,int targetWidth,int targetHeight) 
    {
        if ( targetWidth < 0 || targetHeight < 0 ) {
            throw new IllegalArgumentException("Invalid target dimensions: "+targetWidth+"x"+targetHeight);
        }
        final long cellCount = (long) targetWidth * targetHeight;
        if ( cellCount > MAX_CELLS ) {
            throw new IllegalArgumentException("Target dimensions "+targetWidth+"x"+targetHeight+" exceed the maximum of "+MAX_CELLS+" cells");
        }

        final int sourceWidth = gray.getWidth();
        final AxisPartition rows = RangePartitioner.partition( targetHeight , gray.getHeight() );
        final AxisPartition columns = RangePartitioner.partition( targetWidth , sourceWidth );
        if ( rows.coveredLength() > gray.getHeight() || columns.coveredLength() > sourceWidth ) {
            throw new ResamplingInvariantViolation("Partitions cover "+columns.coveredLength()+"x"+rows.coveredLength()+
                    " pixels of a "+sourceWidth+"x"+gray.getHeight()+" image");
        }

        final byte[] result = new byte[ (int) cellCount ];
        int ptr = 0;
        for ( int r = 0 , rowCount = rows.size() ; r < rowCount ; r++ ) 
        {
            final Span rowSpan = rows.get( r );
            for ( int c = 0 , columnCount = columns.size() ; c < columnCount ; c++ ) 
            {
                final Span columnSpan = columns.get( c );
                long sum = 0;
                int count = 0;
                for ( int y = rowSpan.start ; y < rowSpan.end ; y++ ) 
                {
                    final int rowOffset = y * sourceWidth;
                    for ( int x = columnSpan.start ; x < columnSpan.end ; x++ ) 
                    {
                        sum += gray.sampleAt( rowOffset + x );
                        count++;
                    }
                }
                result[ptr++] = count == 0 ? 0 : (byte) (sum / count);
            }
        }
        return new OutputGrid( targetWidth , targetHeight , result );
    }
}
