/*
Copyright 2026 The seqsort Authors
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package seqsort.util.sort;

import seqsort.Ordering;
import seqsort.TypeMismatchException;


// Sort direction. Resolves the order predicate used by all the algorithms:
// before(a, b) is (a < b) when ascending and (a > b) when descending.
public enum Direction
{
   ASCENDING,
   DESCENDING;


   private static final Ordering<Object> NATURAL = new Ordering<Object>()
   {
      @Override
      public boolean before(Object a, Object b)
      {
         return compare(a, b) < 0;
      }
   };

   private static final Ordering<Object> REVERSE = new Ordering<Object>()
   {
      @Override
      public boolean before(Object a, Object b)
      {
         return compare(a, b) > 0;
      }
   };


   public static Direction of(boolean ascending)
   {
      return (ascending) ? ASCENDING : DESCENDING;
   }


   public boolean isAscending()
   {
      return this == ASCENDING;
   }


   public Direction reverse()
   {
      return (this == ASCENDING) ? DESCENDING : ASCENDING;
   }


   @SuppressWarnings("unchecked")
   public <T extends Comparable<? super T>> Ordering<T> ordering()
   {
      return (Ordering<T>) (Ordering<?>) ((this == ASCENDING) ? NATURAL : REVERSE);
   }


   // Natural order comparison. Fails on the first pair of values that cannot
   // be compared instead of coercing them.
   @SuppressWarnings("unchecked")
   public static int compare(Object a, Object b)
   {
      if ((a == null) || (b == null))
         throw new TypeMismatchException(a, b);

      try
      {
         return ((Comparable<Object>) a).compareTo(b);
      }
      catch (ClassCastException e)
      {
         throw new TypeMismatchException(a, b, e);
      }
   }
}
