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


// Common base of the comparison sorts: holds the order predicate and the
// shared range check and swap primitives.
public abstract class AbstractSorter<T> implements Sorter<T>
{
   private final Ordering<? super T> cmp;


   protected AbstractSorter(Ordering<? super T> cmp)
   {
      if (cmp == null)
         throw new NullPointerException("Invalid null ordering parameter");

      this.cmp = cmp;
   }


   public Ordering<? super T> getOrdering()
   {
      return this.cmp;
   }


   protected static boolean isValidRange(Object[] input, int blkptr, int len)
   {
      return (input != null) && (blkptr >= 0) && (len >= 0) && (blkptr+len <= input.length);
   }


   protected static void swap(Object[] array, int i, int j)
   {
      final Object tmp = array[i];
      array[i] = array[j];
      array[j] = tmp;
   }
}
