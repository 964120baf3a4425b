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


// Orders positions of a fixed array by the values stored at these positions.
// Sorting an array of positions with this ordering performs exactly the same
// moves as sorting the values themselves, hence yields the index array.
public final class IndexOrdering<T> implements Ordering<Integer>
{
   private final T[] array;
   private final Ordering<? super T> ordering;


   public IndexOrdering(T[] array, Ordering<? super T> ordering)
   {
      if (array == null)
         throw new NullPointerException("Invalid null array parameter");

      if (ordering == null)
         throw new NullPointerException("Invalid null ordering parameter");

      this.array = array;
      this.ordering = ordering;
   }


   @Override
   public boolean before(Integer lidx, Integer ridx)
   {
      return this.ordering.before(this.array[lidx], this.array[ridx]);
   }


   public static Integer[] identity(int length)
   {
      final Integer[] res = new Integer[length];

      for (int i=0; i<length; i++)
         res[i] = i;

      return res;
   }
}
