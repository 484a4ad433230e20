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
 * Half-open interval <code>[start,end)</code> along one axis of the source image.
 * 
 * A span may be empty.
 *
 * @author tobias.gierke@code-sourcery.de
 */
public final class Span
{
    public final int start;
    public final int end;

    public Span(int start, int end) 
    {
        if ( start < 0 || end < start ) {
            throw new IllegalArgumentException("Invalid span: "+start+".."+end);
        }
        this.start = start;
        this.end = end;
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    @Override
    public boolean equals(Object obj) 
    {
        if ( this == obj ) {
            return true;
        }
        if ( obj instanceof Span ) {
            final Span other = (Span) obj;
            return start == other.start && end == other.end;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return start+".."+end;
    }
}
