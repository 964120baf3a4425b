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
import seqsort.Sorter;


public final class SorterFactory
{
   private SorterFactory()
   {
   }


   // The configuration only contributes the algorithm specific parameters
   // (gap for shell sort, pivot for quick sort). Direction is carried by the
   // ordering.
   public static <T> Sorter<T> newSorter(SortMethod method, Ordering<? super T> cmp, SortConfig cfg)
   {
      if (method == null)
         throw new NullPointerException("Invalid null sort method");

      if (cfg == null)
         cfg = SortConfig.DEFAULT;

      switch (method)
      {
         case BUBBLE:
            return new BubbleSort<>(cmp);

         case SHORT_BUBBLE:
            return new ShortBubbleSort<>(cmp);

         case SELECTION:
            return new SelectionSort<>(cmp);

         case INSERTION:
            return new InsertionSort<>(cmp);

         case SHELL:
            if (cfg.getGap() == null)
               return new ShellSort<>(cmp);

            return new ShellSort<>(cmp, cfg.getGap().intValue());

         case QUICK:
            return newQuickSort(cmp, cfg);

         case MERGE:
            return new MergeSort<>(cmp);

         case HEAP:
            return new HeapSort<>(cmp);

         default:
            throw new IllegalArgumentException("Unsupported sort method: "+method);
      }
   }


   private static <T> Sorter<T> newQuickSort(Ordering<? super T> cmp, SortConfig cfg)
   {
      if (cfg.getPivotIndex() != null)
         return new QuickSort<>(cmp, cfg.getPivotIndex().intValue());

      if (cfg.getPivotPosition() != null)
         return new QuickSort<>(cmp, cfg.getPivotPosition().doubleValue());

      if (cfg.getPivotStrategy() != null)
         return new QuickSort<>(cmp, cfg.getPivotStrategy());

      return new QuickSort<>(cmp);
   }
}
