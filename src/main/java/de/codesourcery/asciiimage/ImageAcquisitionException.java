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

import java.io.IOException;

/**
 * Thrown when no image could be obtained from a file or the clipboard.
 *
 * @author tobias.gierke@code-sourcery.de
 */
public class ImageAcquisitionException extends IOException
{
    private static final long serialVersionUID = 1L;

    public ImageAcquisitionException(String message)
    {
        super(message);
    }

    public ImageAcquisitionException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
