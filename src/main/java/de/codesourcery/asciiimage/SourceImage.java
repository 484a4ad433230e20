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
 * An RGBA image, 4 bytes per pixel in row-major order.
 * 
 * Instances are created either by {@link #wrap(int, int, byte[]) borrowing} the caller's
 * array or by {@link #copyOf(int, int, byte[]) copying} it. A wrapped array must not be modified
 * while the image is in use.
 *
 * @author tobias.gierke@code-sourcery.de
 */
public final class SourceImage
{
    public static final int BYTES_PER_PIXEL = 4;

    public static final SourceImage EMPTY = new SourceImage( 0 , 0 , new byte[0] );

    private final int width;
    private final int height;
    private final byte[] rgba;

    private SourceImage(int width, int height, byte[] rgba) 
    {
        this.width = width;
        this.height = height;
        this.rgba = rgba;
    }

    /**
     * Creates an image that uses the given array directly.
     * 
     * @param width image width in pixels
     * @param height image height in pixels
     * @param rgba pixel data, must hold exactly <code>4*width*height</code> bytes
     * @throws InvalidImageDataException if the dimensions are negative or don't match the array length
     */
    public static SourceImage wrap(int width,int height,byte[] rgba) throws InvalidImageDataException
    {
        checkDimensions( width , height , rgba );
        return new SourceImage( width , height , rgba );
    }

    /**
     * Creates an image backed by a private copy of the given array.
     * 
     * @see #wrap(int, int, byte[])
     */
    public static SourceImage copyOf(int width,int height,byte[] rgba) throws InvalidImageDataException
    {
        checkDimensions( width , height , rgba );
        return new SourceImage( width , height , rgba.clone() );
    }

    private static void checkDimensions(int width,int height,byte[] rgba) 
    {
        if ( rgba == null ) {
            throw new InvalidImageDataException("Pixel data must not be NULL");
        }
        if ( width < 0 || height < 0 ) {
            throw new InvalidImageDataException("Invalid image dimensions: "+width+"x"+height);
        }
        final long expected = (long) BYTES_PER_PIXEL * width * height;
        if ( rgba.length != expected ) {
            throw new InvalidImageDataException("Expected "+expected+" bytes for a "+width+"x"+height+" RGBA image but got "+rgba.length);
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * Returns the raw RGBA data.
     * 
     * The array is shared with this image, callers must treat it as read-only.
     */
    byte[] rgba() {
        return rgba;
    }

    @Override
    public String toString() {
        return "SourceImage[ "+width+"x"+height+" ]";
    }
}
