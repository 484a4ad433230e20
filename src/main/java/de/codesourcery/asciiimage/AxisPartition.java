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

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered list of adjacent {@link Span}s along one axis of the source image, 
 * one span per output cell.
 *
 * @author tobias.gierke@code-sourcery.de
 * @see RangePartitioner
 */
public final class AxisPartition implements Iterable<Span>
{
    public static final AxisPartition EMPTY = new AxisPartition( new Span[0] );

    private final Span[] spans;

    AxisPartition(Span[] spans) 
    {
        for ( int i = 1 ; i < spans.length ; i++ ) 
        {
            if ( spans[i].start != spans[i-1].end ) {
                throw new ResamplingInvariantViolation("Span "+spans[i]+" does not continue "+spans[i-1]);
            }
        }
        this.spans = spans;
    }

    public int size() {
        return spans.length;
    }

    public boolean isEmpty() {
        return spans.length == 0;
    }

    public Span get(int index) {
        return spans[index];
    }

    /**
     * Returns the exclusive end of the last span, 0 for an empty partition.
     */
    public int coveredLength() {
        return spans.length == 0 ? 0 : spans[ spans.length-1 ].end;
    }

    public List<Span> asList() {
        return Collections.unmodifiableList( Arrays.asList( spans ) );
    }

    @Override
    public Iterator<Span> iterator() {
        return asList().iterator();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof AxisPartition && Arrays.equals( spans , ((AxisPartition) obj).spans );
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode( spans );
    }

    @Override
    public String toString() {
        return Arrays.toString( spans );
    }
}
