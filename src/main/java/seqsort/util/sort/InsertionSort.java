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


// Simple sorting algorithm with O(n*n) worst case complexity, O(n) on nearly
// sorted data. Efficient on small data sets. Stable.
public class InsertionSort<T> extends AbstractSorter<T>
{
   public InsertionSort(Ordering<? super T> cmp)
   {
      super(cmp);
   }


   @Override
   public boolean sort(T[] input, int blkptr, int len)
   {
      if (isValidRange(input, blkptr, len) == false)
         return false;

      if (len < 2)
         return true;

      // Shortcut for 2 element-sub-array
      if (len == 2)
      {
         if (this.getOrdering().before(input[blkptr+1], input[blkptr]))
            swap(input, blkptr, blkptr+1);

         return true;
      }

      sortWithGap(input, blkptr, blkptr+len, 1, this.getOrdering());
      return true;
   }


   // Insertion sort of the interleaved sub-arrays of elements 'gap' apart.
   // Elements only move past elements placed strictly after them.
   static <T> void sortWithGap(T[] array, int blkptr, int end, int gap, Ordering<? super T> cmp)
   {
      final int start = blkptr + gap;

      for (int i=start; i<end; i++)
      {
         final T val = array[i];
         int j = i;

         while ((j >= start) && (cmp.before(val, array[j-gap])))
         {
            array[j] = array[j-gap];
            j -= gap;
         }

         array[j] = val;
      }
   }
}
