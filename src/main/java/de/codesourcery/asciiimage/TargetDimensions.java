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

import java.util.Map;

/**
 * Number of output columns and rows.
 * 
 * Character cells on a terminal are usually about twice as high as they are wide, so
 * the aspect-ratio helpers take a <i>character aspect</i> (cell width divided by cell height)
 * into account when mapping image pixels to cells.
 *
 * @author tobias.gierke@code-sourcery.de
 */
public final class TargetDimensions
{
    public static final int DEFAULT_COLUMNS = 80;
    public static final int DEFAULT_ROWS = 24;

    public static final double DEFAULT_CHAR_ASPECT = 0.5;

    public final int columns;
    public final int rows;

    public TargetDimensions(int columns, int rows) 
    {
        if ( columns < 0 || rows < 0 ) {
            throw new IllegalArgumentException("Invalid dimensions: "+columns+"x"+rows);
        }
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * Returns the terminal size as advertised by the <code>COLUMNS</code> and <code>LINES</code>
     * environment variables, falling back to {@link #DEFAULT_COLUMNS} x {@link #DEFAULT_ROWS}.
     */
    public static TargetDimensions fromEnvironment(Map<String,String> environment) 
    {
        return new TargetDimensions( 
                parsePositive( environment.get("COLUMNS") , DEFAULT_COLUMNS ) ,
                parsePositive( environment.get("LINES") , DEFAULT_ROWS ) );
    }

    private static int parsePositive(String value,int defaultValue) 
    {
        if ( value == null ) {
            return defaultValue;
        }
        try {
            final int result = Integer.parseInt( value.trim() );
            return result > 0 ? result : defaultValue;
        } 
        catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Shrinks an image to fit into these dimensions while keeping its aspect ratio.
     * 
     * Images that already fit are not enlarged.
     * 
     * @param imageWidth image width in pixels
     * @param imageHeight image height in pixels
     * @param charAspect width of a character cell divided by its height
     */
    public TargetDimensions fit(int imageWidth,int imageHeight,double charAspect) 
    {
        checkCharAspect( charAspect );
        if ( imageWidth == 0 || imageHeight == 0 || columns == 0 || rows == 0 ) {
            return new TargetDimensions(0,0);
        }
        final double cellHeight = imageHeight * charAspect;
        final double scale = Math.min( 1.0 , Math.min( columns / (double) imageWidth , rows / cellHeight ) );
        final int newColumns = clamp( (int) Math.floor( imageWidth * scale ) , columns );
        final int newRows = clamp( (int) Math.floor( cellHeight * scale ) , rows );
        return new TargetDimensions( newColumns , newRows );
    }

    /**
     * Calculates how many rows an image needs when rendered with a given number of columns.
     */
    public static int rowsFor(int columns,int imageWidth,int imageHeight,double charAspect) 
    {
        checkCharAspect( charAspect );
        if ( columns == 0 || imageWidth == 0 || imageHeight == 0 ) {
            return 0;
        }
        return toCells( Math.round( columns * (imageHeight * charAspect) / imageWidth ) );
    }

    /**
     * Calculates how many columns an image needs when rendered with a given number of rows.
     */
    public static int columnsFor(int rows,int imageWidth,int imageHeight,double charAspect) 
    {
        checkCharAspect( charAspect );
        if ( rows == 0 || imageWidth == 0 || imageHeight == 0 ) {
            return 0;
        }
        return toCells( Math.round( (double) rows * imageWidth / (imageHeight * charAspect) ) );
    }

    private static int toCells(long value) 
    {
        if ( value > Integer.MAX_VALUE ) {
            throw new IllegalArgumentException("Calculated size "+value+" is too large");
        }
        return Math.max( 1 , (int) value );
    }

    private static void checkCharAspect(double charAspect) 
    {
        if ( ! ( charAspect > 0 ) || Double.isInfinite( charAspect ) ) {
            throw new IllegalArgumentException("Character aspect must be a positive number but was "+charAspect);
        }
    }

    private static int clamp(int value,int max) {
        return Math.max( 1 , Math.min( value , max ) );
    }

    @Override
    public boolean equals(Object obj) 
    {
        if ( obj instanceof TargetDimensions ) {
            final TargetDimensions other = (TargetDimensions) obj;
            return columns == other.columns && rows == other.rows;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * columns + rows;
    }

    @Override
    public String toString() {
        return columns+"x"+rows;
    }
}
