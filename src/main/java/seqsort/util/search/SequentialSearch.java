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

package seqsort.util.search;

import java.util.Objects;
import seqsort.Ordering;


// Left to right linear scan, O(n). Works on unsorted data.
public final class SequentialSearch
{
   public static final int NOT_FOUND = -1;


   private SequentialSearch()
   {
   }


   // Return the first index holding a value equal to 'target', else NOT_FOUND
   public static int search(Object[] data, Object target)
   {
      if (data == null)
         throw new NullPointerException("Invalid null array parameter");

      for (int i=0; i<data.length; i++)
      {
         if (Objects.equals(data[i], target))
            return i;
      }

      return NOT_FOUND;
   }


   // Same as search() on data sorted according to 'cmp': the scan stops as
   // soon as it passes the position the target would occupy.
   public static <T> int searchSorted(T[] data, T target, Ordering<? super T> cmp)
   {
      if (data == null)
         throw new NullPointerException("Invalid null array parameter");

      if (cmp == null)
         throw new NullPointerException("Invalid null ordering parameter");

      for (int i=0; i<data.length; i++)
      {
         if (Objects.equals(data[i], target))
            return i;

         if (cmp.before(target, data[i]))
            break;
      }

      return NOT_FOUND;
   }
}
