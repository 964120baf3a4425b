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

import seqsort.Ordering;
import seqsort.util.sort.Direction;


// Logarithmic lookup in sorted data.
// Precondition: the data must be sorted (ascending unless an ordering is
// provided). It is NOT checked: on unsorted data the result is undefined.
// With duplicates, any one of the matching indexes may be returned.
public final class BinarySearch
{
   public static final int NOT_FOUND = SequentialSearch.NOT_FOUND;


   private BinarySearch()
   {
   }


   public static <T extends Comparable<? super T>> int search(T[] data, T target)
   {
      return search(data, target, Direction.ASCENDING.<T>ordering());
   }


   public static <T> int search(T[] data, T target, Ordering<? super T> cmp)
   {
      if (data == null)
         throw new NullPointerException("Invalid null array parameter");

      return search(data, 0, data.length, target, cmp);
   }


   // Search the 'len' elements starting at 'blkptr'. The returned index is
   // absolute (relative to the start of the array).
   public static <T> int search(T[] data, int blkptr, int len, T target, Ordering<? super T> cmp)
   {
      if (data == null)
         throw new NullPointerException("Invalid null array parameter");

      if (cmp == null)
         throw new NullPointerException("Invalid null ordering parameter");

      if ((blkptr < 0) || (len < 0) || (blkptr+len > data.length))
         throw new IllegalArgumentException("Invalid range: start="+blkptr+", length="+len);

      int start = blkptr;
      int end = blkptr + len - 1;

      while (start <= end)
      {
         final int mid = (start+end) >>> 1;

         if (cmp.before(target, data[mid]))
            end = mid - 1;
         else if (cmp.before(data[mid], target))
            start = mid + 1;
         else
            return mid;
      }

      return NOT_FOUND;
   }
}
