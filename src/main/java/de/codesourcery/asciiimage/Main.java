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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import picocli.CommandLine;

/**
 * Command-line front end.
 * 
 * Reads an image from a file (or the clipboard if no file is given), converts it and
 * prints the result to stdout or a file.
 *
 * @author tobias.gierke@code-sourcery.de
 */
@CommandLine.Command(name = "ascii-image",
    mixinStandardHelpOptions = true,
    version = "ascii-image 1.0.0",
    header = "Render an image as ASCII characters",
    description = "Converts an image file, or the image currently on the clipboard, to a grid of characters. " +
        "Unless --width and --height are both given, the output is fitted into the terminal size " +
        "(COLUMNS x LINES, default 80x24) keeping the image's aspect ratio.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:image could not be read or converted", "2:invalid usage"})
public class Main implements Callable<Integer>
{
    private static final Logger logger = LogManager.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "FILE",
        description = "Image file to convert; reads the clipboard when omitted")
    private Path file;

    @CommandLine.Option(names = {"-W", "--width"}, paramLabel = "COLUMNS",
        description = "Number of output columns")
    private Integer width;

    @CommandLine.Option(names = {"-H", "--height"}, paramLabel = "ROWS",
        description = "Number of output rows")
    private Integer height;

    @CommandLine.Option(names = "--no-fit",
        description = "Use the available size as-is instead of keeping the image's aspect ratio")
    private boolean noFit = false;

    @CommandLine.Option(names = "--char-aspect", paramLabel = "RATIO",
        description = "Width of a character cell divided by its height (default: ${DEFAULT-VALUE})")
    private double charAspect = TargetDimensions.DEFAULT_CHAR_ASPECT;

    @CommandLine.Option(names = {"-g", "--gradient"}, paramLabel = "CHARS",
        description = "Characters to render with, ordered from dark to light (default: \"${DEFAULT-VALUE}\")")
    private String gradient = SymbolMapper.DEFAULT_GRADIENT;

    @CommandLine.Option(names = {"-i", "--invert"},
        description = "Invert the gradient, for dark text on a light background")
    private boolean invert = false;

    @CommandLine.Option(names = {"-c", "--crop"},
        description = "Remove trailing whitespace and leading blank lines")
    private boolean crop = false;

    @CommandLine.Option(names = "--black-threshold", paramLabel = "0-255",
        description = "Brightness values at or below this become black (default: ${DEFAULT-VALUE})")
    private int blackThreshold = 0;

    @CommandLine.Option(names = "--white-threshold", paramLabel = "0-255",
        description = "Brightness values at or above this become white (default: ${DEFAULT-VALUE})")
    private int whiteThreshold = 255;

    @CommandLine.Option(names = "--raw",
        description = "Print brightness values instead of characters")
    private boolean raw = false;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "FILE",
        description = "Write the result to this file instead of stdout")
    private Path output;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final Map<String,String> environment;

    public Main() {
        this( System.getenv() );
    }

    Main(Map<String,String> environment) {
        this.environment = environment;
    }

    public static void main(String[] args)
    {
        final int exitCode = createCommandLine( new Main() ).execute( args );
        logger.debug("Exiting with code {}", exitCode);
        System.exit( exitCode );
    }

    static CommandLine createCommandLine(Main command) 
    {
        return new CommandLine( command )
            .setExecutionExceptionHandler( Main::handleExecutionException );
    }

    private static int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) throws Exception 
    {
        if ( ex instanceof ImageAcquisitionException || ex instanceof InvalidImageDataException ) 
        {
            logger.debug("Conversion failed", ex);
            commandLine.getErr().println( "error: "+ex.getMessage() );
            return EXIT_FAILURE;
        }
        throw ex;
    }

    @Override
    public Integer call() throws IOException 
    {
        validateOptions();

        final SourceImage image;
        if ( file != null ) {
            logger.info("Reading image from {}", file);
            image = ImageLoader.fromFile( file );
        } else {
            logger.info("Reading image from clipboard");
            image = ImageLoader.fromClipboard();
        }

        final TargetDimensions size = resolveTargetDimensions( image );
        logger.info("Converting {} to {}", image, size);

        final ImageToAscii converter = new ImageToAscii();
        converter.setGradient( gradient );
        converter.setInvert( invert );
        converter.setCropASCIIOutput( crop );
        converter.setBlackThreshold( blackThreshold );
        converter.setWhiteThreshold( whiteThreshold );

        final OutputGrid grid = converter.toGrid( image , size.columns , size.rows );
        final String text = raw ? grid.toString() : converter.toASCII( grid );

        if ( output != null ) 
        {
            try (BufferedWriter writer = Files.newBufferedWriter( output , StandardCharsets.UTF_8 )) {
                writer.write( text );
            }
            logger.info("Wrote {}x{} characters to {}", grid.getWidth(), grid.getHeight(), output);
        } 
        else 
        {
            final PrintWriter out = spec.commandLine().getOut();
            out.print( text );
            out.flush();
        }
        return EXIT_OK;
    }

    private void validateOptions() 
    {
        if ( (width != null && width < 0) || (height != null && height < 0) ) {
            throw new CommandLine.ParameterException( spec.commandLine() , "Width and height must not be negative" );
        }
        if ( width != null && height != null && (long) width * height > BoxResampler.MAX_CELLS ) {
            throw new CommandLine.ParameterException( spec.commandLine() , "Output of "+width+"x"+height+" characters is too large" );
        }
        if ( ! ( charAspect > 0 ) || Double.isInfinite( charAspect ) ) {
            throw new CommandLine.ParameterException( spec.commandLine() , "Character aspect must be a positive number but was "+charAspect );
        }
        if ( gradient.isEmpty() ) {
            throw new CommandLine.ParameterException( spec.commandLine() , "Gradient must contain at least one character" );
        }
        if ( blackThreshold < 0 || blackThreshold > 255 || whiteThreshold < 0 || whiteThreshold > 255 ) {
            throw new CommandLine.ParameterException( spec.commandLine() , "Thresholds must be in range 0...255" );
        }
    }

    TargetDimensions resolveTargetDimensions(SourceImage image) 
    {
        if ( width != null && height != null ) {
            return new TargetDimensions( width , height );
        }
        final TargetDimensions available = TargetDimensions.fromEnvironment( environment );
        if ( noFit ) {
            return new TargetDimensions( width != null ? width : available.columns , height != null ? height : available.rows );
        }
        if ( width != null ) {
            return new TargetDimensions( width , TargetDimensions.rowsFor( width , image.getWidth() , image.getHeight() , charAspect ) );
        }
        if ( height != null ) {
            return new TargetDimensions( TargetDimensions.columnsFor( height , image.getWidth() , image.getHeight() , charAspect ) , height );
        }
        return available.fit( image.getWidth() , image.getHeight() , charAspect );
    }
}
