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
import seqsort.util.BinaryHeap;


// HeapSort is a comparison sort with O(n ln n) complexity. Practically, it is
// usually slower than QuickSort. Not stable.
// The heap root is the element placed first by the ordering (min heap when
// ascending, max heap when descending) and is extracted front to back.
public class HeapSort<T> extends AbstractSorter<T>
{
   public HeapSort(Ordering<? super T> cmp)
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

      final BinaryHeap<T> heap = new BinaryHeap<>(this.getOrdering(), input, blkptr, len);
      final int end = blkptr + len;

      for (int i=blkptr; i<end; i++)
         input[i] = heap.extractRoot();

      return true;
   }
}
