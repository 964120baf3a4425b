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

import seqsort.InvalidParameterException;
import seqsort.Ordering;


// Insertion sort generalized to a decreasing sequence of gaps, ending with
// gap 1. Complexity between O(n) and O(n*n) depending on the gaps. Not stable.
// The gap sequence halves at each step, starting either from the provided
// gap or from n/2.
public class ShellSort<T> extends AbstractSorter<T>
{
   private final int gap; // 0 means default sequence


   public ShellSort(Ordering<? super T> cmp)
   {
      super(cmp);
      this.gap = 0;
   }


   public ShellSort(Ordering<? super T> cmp, int gap)
   {
      super(cmp);

      if (gap < 1)
         throw new InvalidParameterException("Invalid shell sort gap: "+gap+" (must be at least 1)");

      this.gap = gap;
   }


   public int getGap()
   {
      return this.gap;
   }


   @Override
   public boolean sort(T[] input, int blkptr, int len)
   {
      if (isValidRange(input, blkptr, len) == false)
         return false;

      if ((this.gap > len) && (len > 0))
      {
         throw new InvalidParameterException("Invalid shell sort gap: "+this.gap+
            " (must be at most the sequence length "+len+")");
      }

      if (len < 2)
         return true;

      final Ordering<? super T> cmp = this.getOrdering();
      final int end = blkptr + len;
      int g = (this.gap == 0) ? len >> 1 : this.gap;

      while (g > 0)
      {
         InsertionSort.sortWithGap(input, blkptr, end, g, cmp);
         g >>= 1;
      }

      return true;
   }
}
