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
 * Converts RGBA pixels to brightness values.
 * 
 * Each pixel's brightness is the truncated average of its color channels, capped to
 * its alpha value. Transparent pixels therefore come out dark no matter what color they have.
 *
 * @author tobias.gierke@code-sourcery.de
 */
public final class GrayscaleReducer
{
    private GrayscaleReducer() {
    }

    /**
     * Reduces an image to a grayscale buffer of the same dimensions.
     */
    public static GrayscaleBuffer reduce(SourceImage image) 
    {
        return new GrayscaleBuffer( image.getWidth() , image.getHeight() , reduce( image.rgba() ) );
    }

    /**
     * Reduces consecutive 4-byte RGBA groups to one brightness byte each.
     * 
     * @param rgba pixel data
     * @return one sample per pixel, in input order
     * @throws InvalidImageDataException if the input length is not a multiple of 4
     */
    public static byte[] reduce(byte[] rgba) throws InvalidImageDataException
    {
        if ( (rgba.length % SourceImage.BYTES_PER_PIXEL) != 0 ) {
            throw new InvalidImageDataException("RGBA data length must be a multiple of 4 but was "+rgba.length);
        }
        final byte[] result = new byte[ rgba.length / SourceImage.BYTES_PER_PIXEL ];
        for ( int src = 0 , dst = 0 , len = rgba.length ; src < len ; src += 4 , dst++ ) 
        {
            result[dst] = (byte) toBrightness( rgba[src] & 0xff , rgba[src+1] & 0xff , rgba[src+2] & 0xff , rgba[src+3] & 0xff );
        }
        return result;
    }

    /**
     * Calculates the brightness of a single pixel.
     * 
     * @return brightness (0...255)
     */
    public static int toBrightness(int red,int green,int blue,int alpha) 
    {
        final int average = (red + green + blue) / 3;
        // cap value to alpha
        return Math.min( average , alpha );
    }
}
