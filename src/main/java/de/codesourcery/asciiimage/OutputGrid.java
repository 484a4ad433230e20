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

import java.util.Arrays;

/**
 * Brightness values of the resampled image, one byte per output cell in row-major order.
 * 
 * Instances are immutable.
 *
 * @author tobias.gierke@code-sourcery.de
 */
public final class OutputGrid
{
    private final int width;
    private final int height;
    private final byte[] data;

    OutputGrid(int width, int height, byte[] data) 
    {
        if ( (long) width * height != data.length ) {
            throw new ResamplingInvariantViolation("Grid of "+width+"x"+height+" cells cannot hold "+data.length+" values");
        }
        this.width = width;
        this.height = height;
        this.data = data;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    /**
     * Returns the brightness of a cell.
     * 
     * @return brightness (0...255)
     * @throws IndexOutOfBoundsException if the cell lies outside of this grid
     */
    public int get(int row,int column) 
    {
        if ( row < 0 || row >= height || column < 0 || column >= width ) {
            throw new IndexOutOfBoundsException("Cell ("+column+","+row+") is outside of "+width+"x"+height+" grid");
        }
        return data[ row * width + column ] & 0xff;
    }

    /**
     * Returns a copy of the row-major cell values.
     */
    public byte[] toByteArray() {
        return data.clone();
    }

    /**
     * Returns the cell values as unsigned ints, handy for comparisons.
     */
    public int[] toIntArray() 
    {
        final int[] result = new int[ data.length ];
        for ( int i = 0 ; i < data.length ; i++ ) {
            result[i] = data[i] & 0xff;
        }
        return result;
    }

    /**
     * Applies a brightness mapping to every cell.
     * 
     * @param mapping table with 256 entries
     */
    public OutputGrid map(int[] mapping) 
    {
        if ( mapping.length != 256 ) {
            throw new IllegalArgumentException("Mapping table needs 256 entries but has "+mapping.length);
        }
        final byte[] result = new byte[ data.length ];
        for ( int i = 0 ; i < data.length ; i++ ) {
            result[i] = (byte) mapping[ data[i] & 0xff ];
        }
        return new OutputGrid( width , height , result );
    }

    @Override
    public boolean equals(Object obj) 
    {
        if ( obj instanceof OutputGrid ) {
            final OutputGrid other = (OutputGrid) obj;
            return width == other.width && height == other.height && Arrays.equals( data , other.data );
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode( data );
    }

    /**
     * Prints one line per row, listing the row's values.
     */
    @Override
    public String toString() 
    {
        final StringBuilder buffer = new StringBuilder();
        if ( width == 0 ) {
            return "";
        }
        for ( int y = 0 ; y < height ; y++ ) 
        {
            buffer.append('[');
            for ( int x = 0 ; x < width ; x++ ) 
            {
                if ( x > 0 ) {
                    buffer.append(", ");
                }
                buffer.append( data[ y*width + x ] & 0xff );
            }
            buffer.append("]\n");
        }
        return buffer.toString();
    }
}
