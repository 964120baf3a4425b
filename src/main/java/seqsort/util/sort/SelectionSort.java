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


// For each position, select the extreme element of the unsorted remainder
// and swap it in. O(n*n) comparisons, at most n-1 swaps. Not stable.
public class SelectionSort<T> extends AbstractSorter<T>
{
   public SelectionSort(Ordering<? super T> cmp)
   {
      super(cmp);
   }


   @Override
   public boolean sort(T[] input, int blkptr, int len)
   {
      if (isValidRange(input, blkptr, len) == false)
         return false;

      final Ordering<? super T> cmp = this.getOrdering();
      final int end = blkptr + len;

      for (int i=blkptr; i<end-1; i++)
      {
         int best = i;

         for (int j=i+1; j<end; j++)
         {
            if (cmp.before(input[j], input[best]))
               best = j;
         }

         if (best != i)
            swap(input, i, best);
      }

      return true;
   }
}
