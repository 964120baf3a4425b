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


// Recursive partition sort. O(n ln n) on average, not stable.
// Each partition moves the pivot to the front of the range, runs two marks
// towards each other swapping misplaced elements, then drops the pivot at
// the crossing point.
// The pivot is selected by a PivotStrategy, by a relative position in [0..1]
// (0 = first element, 1 = last element) or by an explicit index: the first
// partition uses this index and the sub-partitions the same relative position.
// Only the smaller side is recursed into, and once the depth budget (twice the
// log of the length) is exhausted the range is finished by a heap sort, so
// adversarial inputs neither exhaust the stack nor go quadratic.
public class QuickSort<T> extends AbstractSorter<T>
{
   private final PivotStrategy strategy;
   private final double position;
   private final int pivotIndex; // -1 if none


   public QuickSort(Ordering<? super T> cmp)
   {
      this(cmp, PivotStrategy.FIRST);
   }


   public QuickSort(Ordering<? super T> cmp, PivotStrategy strategy)
   {
      super(cmp);

      if (strategy == null)
         throw new InvalidParameterException("Invalid null pivot strategy");

      if (strategy == PivotStrategy.POSITION)
         throw new InvalidParameterException("The POSITION pivot strategy requires a position value");

      this.strategy = strategy;
      this.position = 0;
      this.pivotIndex = -1;
   }


   public QuickSort(Ordering<? super T> cmp, double position)
   {
      super(cmp);

      if ((position >= 0) == false || (position > 1))
         throw new InvalidParameterException("Invalid pivot position: "+position+" (must be in [0..1])");

      this.strategy = PivotStrategy.POSITION;
      this.position = position;
      this.pivotIndex = -1;
   }


   public QuickSort(Ordering<? super T> cmp, int pivotIndex)
   {
      super(cmp);

      if (pivotIndex < 0)
         throw new InvalidParameterException("Invalid pivot index: "+pivotIndex+" (must be at least 0)");

      this.strategy = PivotStrategy.POSITION;
      this.position = -1;
      this.pivotIndex = pivotIndex;
   }


   public PivotStrategy getPivotStrategy()
   {
      return this.strategy;
   }


   @Override
   public boolean sort(T[] input, int blkptr, int len)
   {
      if (isValidRange(input, blkptr, len) == false)
         return false;

      if ((this.pivotIndex >= 0) && (this.pivotIndex >= len) && (len > 0))
      {
         throw new InvalidParameterException("Invalid pivot index: "+this.pivotIndex+
            " (must be less than the sequence length "+len+")");
      }

      if (len < 2)
         return true;

      double pos = this.position;
      int first = -1;

      if (this.pivotIndex >= 0)
      {
         pos = (double) this.pivotIndex / (len-1);
         first = blkptr + this.pivotIndex;
      }

      final int budget = 2 * (32 - Integer.numberOfLeadingZeros(len));
      this.sortRange(input, blkptr, blkptr+len-1, budget, pos, first);
      return true;
   }


   private void sortRange(T[] data, int low, int high, int budget, double pos, int first)
   {
      while (low < high)
      {
         if (budget == 0)
         {
            new HeapSort<T>(this.getOrdering()).sort(data, low, high-low+1);
            return;
         }

         budget--;
         final int pivot = (first >= 0) ? first : this.selectPivot(data, low, high, pos);
         first = -1;
         final int split = this.partition(data, low, high, pivot);

         // Recurse on the smaller side, iterate on the larger one
         if (split-low < high-split)
         {
            this.sortRange(data, low, split-1, budget, pos, -1);
            low = split + 1;
         }
         else
         {
            this.sortRange(data, split+1, high, budget, pos, -1);
            high = split - 1;
         }
      }
   }


   private int selectPivot(T[] data, int low, int high, double pos)
   {
      switch (this.strategy)
      {
         case FIRST:
            return low;

         case LAST:
            return high;

         case MIDDLE:
            return (low+high) >>> 1;

         case MEDIAN_OF_THREE:
            return this.medianOfThree(data, low, (low+high) >>> 1, high);

         case POSITION:
            return low + (int) (pos * (high-low));

         default:
            throw new IllegalStateException("Unsupported pivot strategy: "+this.strategy);
      }
   }


   private int medianOfThree(T[] data, int a, int b, int c)
   {
      final Ordering<? super T> cmp = this.getOrdering();

      if (cmp.before(data[b], data[a]))
      {
         final int t = a;
         a = b;
         b = t;
      }

      // data[a] <= data[b]
      if (cmp.before(data[c], data[b]))
         return (cmp.before(data[c], data[a])) ? a : c;

      return b;
   }


   // Return the final position of the pivot
   private int partition(T[] data, int low, int high, int pivotIdx)
   {
      final Ordering<? super T> cmp = this.getOrdering();
      swap(data, low, pivotIdx);
      final T pivot = data[low];
      int left = low + 1;
      int right = high;

      while (true)
      {
         while ((left <= right) && (cmp.before(pivot, data[left]) == false))
            left++;

         while ((right >= left) && (cmp.before(data[right], pivot) == false))
            right--;

         // Marks crossed: the right mark is the split point
         if (right < left)
            break;

         swap(data, left, right);
      }

      swap(data, low, right);
      return right;
   }
}
