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
 * Single-channel brightness samples of an image, one byte per pixel in row-major order.
 * 
 * Instances are immutable.
 *
 * @author tobias.gierke@code-sourcery.de
 */
public final class GrayscaleBuffer
{
    private final int width;
    private final int height;
    private final byte[] samples;

    GrayscaleBuffer(int width, int height, byte[] samples) 
    {
        if ( (long) width * height != samples.length ) {
            throw new InvalidImageDataException("Expected "+((long) width*height)+" samples for a "+width+"x"+height+" image but got "+samples.length);
        }
        this.width = width;
        this.height = height;
        this.samples = samples;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * Returns the brightness at a row-major index.
     * 
     * @param index <code>row * width + column</code>
     * @return brightness (0...255)
     * @throws ResamplingInvariantViolation if the index lies outside of this buffer
     */
    public int sampleAt(int index) throws ResamplingInvariantViolation
    {
        if ( index < 0 || index >= samples.length ) {
            throw new ResamplingInvariantViolation("Tried accessing sample "+index+" outside of image bounds ("+width+"x"+height+")");
        }
        return samples[index] & 0xff;
    }

    /**
     * Returns the brightness at a given pixel position.
     * 
     * @throws ResamplingInvariantViolation if the position lies outside of this buffer
     */
    public int sample(int row,int column) throws ResamplingInvariantViolation
    {
        if ( row < 0 || row >= height || column < 0 || column >= width ) {
            throw new ResamplingInvariantViolation("Tried accessing pixel ("+column+","+row+") outside of image bounds ("+width+"x"+height+")");
        }
        return samples[ row * width + column ] & 0xff;
    }

    public byte[] toByteArray() {
        return samples.clone();
    }

    @Override
    public String toString() {
        return "GrayscaleBuffer[ "+width+"x"+height+" ]";
    }
}
