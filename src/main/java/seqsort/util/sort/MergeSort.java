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

import java.util.Arrays;
import seqsort.Ordering;


// A MergeSort is conceptually very simple (divide and merge) but requires
// an auxiliary buffer as large as the data. O(n ln n) in all cases. Stable.
// Not thread safe (the buffer is reused between calls).
public class MergeSort<T> extends AbstractSorter<T>
{
   private static final int SMALL_ARRAY_THRESHOLD = 16;

   private Object[] buffer;
   private final InsertionSort<T> insertionSort;


   public MergeSort(Ordering<? super T> cmp)
   {
      super(cmp);
      this.buffer = new Object[0];
      this.insertionSort = new InsertionSort<>(cmp);
   }


   @Override
   public boolean sort(T[] input, int blkptr, int len)
   {
      if (isValidRange(input, blkptr, len) == false)
         return false;

      if (len < 2)
         return true;

      if (this.buffer.length < input.length)
         this.buffer = new Object[input.length];

      this.mergesort(input, blkptr, blkptr+len-1);

      // Do not retain references to the sorted elements
      Arrays.fill(this.buffer, blkptr, blkptr+len, null);
      return true;
   }


   private void mergesort(T[] data, int low, int high)
   {
      if (low >= high)
         return;

      final int count = high - low + 1;

      // Insertion sort on smallest arrays (stable as well)
      if (count < SMALL_ARRAY_THRESHOLD)
      {
         this.insertionSort.sort(data, low, count);
         return;
      }

      final int middle = low + ((count-1) >> 1);
      this.mergesort(data, low, middle);
      this.mergesort(data, middle+1, high);
      this.merge(data, low, middle, high);
   }


   @SuppressWarnings("unchecked")
   private void merge(T[] data, int low, int middle, int high)
   {
      final Ordering<? super T> cmp = this.getOrdering();
      final Object[] buf = this.buffer;
      System.arraycopy(data, low, buf, low, high-low+1);

      int i = low;
      int j = middle + 1;
      int k = low;

      // Take from the right side only if strictly before the left front
      while ((i <= middle) && (j <= high))
      {
         if (cmp.before((T) buf[j], (T) buf[i]))
            data[k++] = (T) buf[j++];
         else
            data[k++] = (T) buf[i++];
      }

      // Remaining right elements are already in place
      if (i <= middle)
         System.arraycopy(buf, i, data, k, middle-i+1);
   }
}
