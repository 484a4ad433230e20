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
 * Maps brightness values to characters from a gradient.
 * 
 * A gradient is a string of characters ordered from darkest to brightest (as seen on a 
 * terminal with light text on a dark background). A brightness <code>b</code> maps to the 
 * character at <code>round(b/255 * (N-1))</code>.
 *
 * @author tobias.gierke@code-sourcery.de
 */
public final class SymbolMapper
{
    /**
     * Default gradient, darkest character first.
     */
    public static final String DEFAULT_GRADIENT = " .:-=+*#%@";

    public static final SymbolMapper DEFAULT = new SymbolMapper( DEFAULT_GRADIENT , false );

    private static final int BRIGHTNESS_MAX = 255;

    private final String gradient;
    private final boolean inverted;

    // look-up table from brightness to character
    private final char[] symbols = new char[ BRIGHTNESS_MAX + 1 ];

    /**
     * Creates a mapper.
     * 
     * @param gradient characters ordered from dark to light, must not be empty
     * @param inverted whether to map dark pixels to light characters and vice versa
     */
    public SymbolMapper(String gradient,boolean inverted) 
    {
        if ( gradient == null || gradient.isEmpty() ) {
            throw new IllegalArgumentException("Gradient must contain at least one character");
        }
        this.gradient = gradient;
        this.inverted = inverted;
        final int last = gradient.length() - 1;
        for ( int brightness = 0 ; brightness <= BRIGHTNESS_MAX ; brightness++ ) 
        {
            final int index = indexOf( brightness , gradient.length() );
            symbols[ brightness ] = gradient.charAt( inverted ? last - index : index );
        }
    }

    /**
     * Calculates the gradient position for a brightness value.
     * 
     * @param brightness brightness (0...255), values outside this range are clamped
     * @param gradientLength number of characters in the gradient
     * @return index in <code>[0,gradientLength-1]</code>
     */
    public static int indexOf(int brightness,int gradientLength) 
    {
        final int index = (int) Math.round( brightness / (double) BRIGHTNESS_MAX * (gradientLength - 1) );
        return Math.max( 0 , Math.min( index , gradientLength - 1 ) );
    }

    public char symbolFor(int brightness) 
    {
        return symbols[ Math.max( 0 , Math.min( brightness , BRIGHTNESS_MAX ) ) ];
    }

    /**
     * Renders a grid as text, with a line break after each row.
     */
    public String toText(OutputGrid grid) 
    {
        final int width = grid.getWidth();
        final int height = grid.getHeight();
        if ( width == 0 ) {
            return "";
        }
        final StringBuilder buffer = new StringBuilder( (width+1) * height );
        for ( int y = 0 ; y < height ; y++ ) 
        {
            for ( int x = 0 ; x < width ; x++ ) {
                buffer.append( symbolFor( grid.get( y , x ) ) );
            }
            buffer.append('\n');
        }
        return buffer.toString();
    }

    public String getGradient() {
        return gradient;
    }

    public boolean isInverted() {
        return inverted;
    }

    @Override
    public String toString() {
        return "SymbolMapper[ \""+gradient+"\""+(inverted ? ", inverted" : "")+" ]";
    }
}
