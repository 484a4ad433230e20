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

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Converts an image to ASCII.
 * 
 * The image is reduced to grayscale and resampled to the requested number of columns and rows 
 * using a box filter (see {@link BoxResampler}). Brightness values at or above the white threshold 
 * become white, those at or below the black threshold become black. Each cell is then mapped to 
 * a character of the configured gradient (see {@link SymbolMapper}).
 * 
 * Instances are not thread-safe.
 *
 * @author tobias.gierke@code-sourcery.de
 */
public class ImageToAscii
{
    private static final Logger logger = LogManager.getLogger(ImageToAscii.class);

    private static final int BRIGHTNESS_MAX = 255;
    private static final int BRIGHTNESS_MIN = 0;

    private int whiteThreshold = BRIGHTNESS_MAX;
    private int blackThreshold = BRIGHTNESS_MIN;

    /***
     * Whether to remove leading blank lines as 
     * well as trailing whitespace from each line.
     */
    private boolean cropASCIIOutput = false;

    private String gradient = SymbolMapper.DEFAULT_GRADIENT;
    private boolean invert = false;

    private SymbolMapper symbolMapper = SymbolMapper.DEFAULT;

    /**
     * Resamples an image and applies the brightness thresholds.
     * 
     * @param image image to convert
     * @param columns number of output columns
     * @param rows number of output rows
     */
    public OutputGrid toGrid(SourceImage image,int columns,int rows) 
    {
        final long time = System.currentTimeMillis();
        OutputGrid grid = BoxResampler.resample( image , columns , rows );
        if ( whiteThreshold < BRIGHTNESS_MAX || blackThreshold > BRIGHTNESS_MIN ) {
            grid = grid.map( thresholdTable() );
        }
        if ( logger.isDebugEnabled() ) {
            logger.debug("Resampled {} to {}x{} in {} ms", image, columns, rows, System.currentTimeMillis() - time);
        }
        return grid;
    }

    public String toASCII(BufferedImage image,int columns,int rows) 
    {
        return toASCII( ImageLoader.toSourceImage( image ) , columns , rows );
    }

    /**
     * Converts an image to text, one line per row.
     * 
     * @param image image to convert
     * @param columns number of output columns
     * @param rows number of output rows
     */
    public String toASCII(SourceImage image,int columns,int rows) 
    {
        return toASCII( toGrid( image , columns , rows ) );
    }

    /**
     * Renders an already resampled grid as text.
     */
    public String toASCII(OutputGrid grid) 
    {
        final String text = symbolMapper.toText( grid );
        return cropASCIIOutput ? crop( text ) : text;
    }

    private int[] thresholdTable() 
    {
        final int[] table = new int[ BRIGHTNESS_MAX+1 ];
        for ( int i = 0 ; i <= BRIGHTNESS_MAX ; i++ ) 
        {
            if ( i >= whiteThreshold ) {
                table[i] = BRIGHTNESS_MAX;
            } else if ( i <= blackThreshold ) {
                table[i] = BRIGHTNESS_MIN;
            } else {
                table[i] = i;
            }
        }
        return table;
    }

    /**
     * Removes trailing spaces from each line as well as leading blank lines.
     */
    static String crop(String text) 
    {
        final List<String> lines = new ArrayList<>();
        final StringBuilder lineBuffer = new StringBuilder();
        for ( int i = 0 , len = text.length() ; i < len ; i++ ) 
        {
            final char c = text.charAt( i );
            if ( c != '\n' ) {
                lineBuffer.append( c );
                continue;
            }
            // trim trailing spaces
            int end = lineBuffer.length();
            while ( end-1 >= 0 && lineBuffer.charAt( end-1 ) == ' ' ) {
                end--;
            }
            lineBuffer.setLength( end );
            lines.add( lineBuffer.toString() );
            lineBuffer.setLength( 0 );
        }

        final StringBuilder outputBuffer = new StringBuilder();
        boolean foundOnlyBlankLines = true;
        for (Iterator<String> it = lines.iterator(); it.hasNext();) 
        {
            final String line = it.next();
            if ( foundOnlyBlankLines && isBlank( line ) ) 
            {
                continue;
            }
            foundOnlyBlankLines = false;
            outputBuffer.append( line ).append('\n');
        }
        return outputBuffer.toString();
    }

    private static boolean isBlank(String line) 
    {
        for ( int i = 0 , len = line.length() ; i < len ; i++ ) {
            if ( ! Character.isWhitespace( line.charAt( i ) ) ) {
                return false;
            }
        }
        return true;
    }

    private static int checkBrightness(int value,String name) 
    {
        if ( value < BRIGHTNESS_MIN || value > BRIGHTNESS_MAX ) {
            throw new IllegalArgumentException(name+" must be in range "+BRIGHTNESS_MIN+"..."+BRIGHTNESS_MAX+" but was "+value);
        }
        return value;
    }

    public void setWhiteThreshold(int whiteThreshold) {
        this.whiteThreshold = checkBrightness( whiteThreshold , "White threshold" );
    }

    public int getWhiteThreshold() {
        return whiteThreshold;
    }

    public void setBlackThreshold(int blackThreshold) {
        this.blackThreshold = checkBrightness( blackThreshold , "Black threshold" );
    }

    public int getBlackThreshold() {
        return blackThreshold;
    }

    public void setCropASCIIOutput(boolean cropASCIIOutput) {
        this.cropASCIIOutput = cropASCIIOutput;
    }

    public boolean isCropASCIIOutput() {
        return cropASCIIOutput;
    }

    /**
     * Sets the characters to render with.
     * 
     * @param gradient characters ordered from dark to light
     */
    public void setGradient(String gradient) 
    {
        this.symbolMapper = new SymbolMapper( gradient , invert );
        this.gradient = gradient;
    }

    public String getGradient() {
        return gradient;
    }

    public void setInvert(boolean invert) 
    {
        this.symbolMapper = new SymbolMapper( gradient , invert );
        this.invert = invert;
    }

    public boolean isInvert() {
        return invert;
    }

    public SymbolMapper getSymbolMapper() {
        return symbolMapper;
    }
}
