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

package seqsort;

import java.util.Arrays;


// Outcome of a sort call: the sorted array (the caller's array when sorting
// in place, a copy otherwise) and the index array when it was requested.
// sorted[k] == original[index[k]] for every k.
public final class SortResult<T>
{
   private final T[] data;
   private final int[] index;


   public SortResult(T[] data, int[] index)
   {
      if (data == null)
         throw new NullPointerException("Invalid null array parameter");

      if ((index != null) && (index.length != data.length))
         throw new IllegalArgumentException("Index length "+index.length+" does not match data length "+data.length);

      this.data = data;
      this.index = index;
   }


   public T[] getData()
   {
      return this.data;
   }


   // Null if the index was not requested
   public int[] getIndex()
   {
      return this.index;
   }


   public boolean hasIndex()
   {
      return this.index != null;
   }


   @Override
   public String toString()
   {
      if (this.index == null)
         return "sorted = " + Arrays.toString(this.data);

      return "sorted = " + Arrays.toString(this.data) + ", index = " + Arrays.toString(this.index);
   }
}
