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

import java.awt.Graphics;
import java.awt.HeadlessException;
import java.awt.Image;
import java.awt.Toolkit;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Obtains images from files or the system clipboard.
 *
 * @author tobias.gierke@code-sourcery.de
 */
public final class ImageLoader
{
    private static final Logger logger = LogManager.getLogger(ImageLoader.class);

    private ImageLoader() {
    }

    /**
     * Reads an image file in any format supported by {@link ImageIO}.
     * 
     * @throws ImageAcquisitionException if the file does not exist, cannot be read or has an unsupported format
     */
    public static SourceImage fromFile(Path file) throws ImageAcquisitionException
    {
        if ( ! Files.exists( file ) ) {
            throw new ImageAcquisitionException("File not found: "+file);
        }
        if ( ! Files.isRegularFile( file ) || ! Files.isReadable( file ) ) {
            throw new ImageAcquisitionException("Not a readable file: "+file);
        }
        final BufferedImage image;
        try {
            image = ImageIO.read( file.toFile() );
        } 
        catch (IOException e) {
            throw new ImageAcquisitionException("Failed to read image from "+file+": "+e.getMessage(), e);
        }
        if ( image == null ) {
            throw new ImageAcquisitionException("Unsupported image format: "+file);
        }
        logger.debug("Loaded {}x{} image from {}", image.getWidth(), image.getHeight(), file);
        return toSourceImage( image );
    }

    /**
     * Reads an image from the system clipboard.
     * 
     * @throws ImageAcquisitionException if there is no clipboard or it doesn't hold an image
     */
    public static SourceImage fromClipboard() throws ImageAcquisitionException
    {
        final Clipboard clipboard;
        try {
            clipboard = Toolkit.getDefaultToolkit().getSystemClipboard();
        } 
        catch (HeadlessException e) {
            throw new ImageAcquisitionException("No clipboard available (running headless)", e);
        }
        return fromClipboard( clipboard );
    }

    /**
     * Reads an image from a clipboard.
     * 
     * @throws ImageAcquisitionException if the clipboard doesn't hold an image
     */
    public static SourceImage fromClipboard(Clipboard clipboard) throws ImageAcquisitionException
    {
        final Object data;
        try 
        {
            data = clipboard.isDataFlavorAvailable( DataFlavor.imageFlavor ) ? clipboard.getData( DataFlavor.imageFlavor ) : null;
        } 
        catch (IllegalStateException | UnsupportedFlavorException | IOException e) {
            throw new ImageAcquisitionException("Failed to get image from clipboard: "+e.getMessage(), e);
        }
        if ( !( data instanceof Image ) ) {
            throw new ImageAcquisitionException("Clipboard does not contain an image");
        }
        final BufferedImage image = toBufferedImage( (Image) data );
        logger.debug("Loaded {}x{} image from clipboard", image.getWidth(), image.getHeight());
        return toSourceImage( image );
    }

    private static BufferedImage toBufferedImage(Image input) throws ImageAcquisitionException
    {
        if ( input instanceof BufferedImage ) {
            return (BufferedImage) input;
        }
        final int width = input.getWidth( null );
        final int height = input.getHeight( null );
        if ( width < 0 || height < 0 ) {
            throw new ImageAcquisitionException("Clipboard image has unknown dimensions");
        }
        final BufferedImage image = new BufferedImage( width , height , BufferedImage.TYPE_INT_ARGB );
        final Graphics gfx = image.getGraphics();
        try {
            gfx.drawImage( input , 0 , 0 , null );
        } finally {
            gfx.dispose();
        }
        return image;
    }

    /**
     * Converts an image of any type to non-premultiplied RGBA bytes.
     */
    public static SourceImage toSourceImage(BufferedImage image) 
    {
        final int width = image.getWidth();
        final int height = image.getHeight();
        final int[] argb = image.getRGB( 0 , 0 , width , height , null , 0 , width );
        final byte[] rgba = new byte[ argb.length * SourceImage.BYTES_PER_PIXEL ];
        int ptr = 0;
        for ( final int pixel : argb ) 
        {
            rgba[ptr++] = (byte) (pixel >> 16);
            rgba[ptr++] = (byte) (pixel >> 8);
            rgba[ptr++] = (byte) pixel;
            rgba[ptr++] = (byte) (pixel >>> 24);
        }
        return SourceImage.wrap( width , height , rgba );
    }
}
