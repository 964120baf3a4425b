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


// N-1 passes of adjacent compare and swap, O(n*n) in all cases. Stable.
public class BubbleSort<T> extends AbstractSorter<T>
{
   public BubbleSort(Ordering<? super T> cmp)
   {
      super(cmp);
   }


   @Override
   public boolean sort(T[] input, int blkptr, int len)
   {
      if (isValidRange(input, blkptr, len) == false)
         return false;

      final Ordering<? super T> cmp = this.getOrdering();

      for (int last=blkptr+len-1; last>blkptr; last--)
      {
         for (int i=blkptr; i<last; i++)
         {
            if (cmp.before(input[i+1], input[i]))
               swap(input, i, i+1);
         }
      }

      return true;
   }
}
