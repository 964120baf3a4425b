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

import java.util.Map;
import seqsort.util.search.BinarySearch;
import seqsort.util.search.SequentialSearch;
import seqsort.util.sort.Direction;
import seqsort.util.sort.IndexOrdering;
import seqsort.util.sort.SortConfig;
import seqsort.util.sort.SortMethod;
import seqsort.util.sort.SorterFactory;


// Entry points of the library. All methods are stateless.
// The configuration is resolved here once: the selected algorithm always
// works on a single array, either the caller's one (in place) or a copy.
// The index array is obtained by running the same algorithm on the original
// positions, ordered by the values they hold.
public final class Sorting
{
   public static final int NOT_FOUND = SequentialSearch.NOT_FOUND;


   private Sorting()
   {
   }


   public static <T extends Comparable<? super T>> SortResult<T> sort(String method, T[] data, SortConfig cfg)
   {
      return sort(SortMethod.fromName(method), data, cfg);
   }


   public static <T extends Comparable<? super T>> SortResult<T> sort(String method, T[] data, Map<String, Object> ctx)
   {
      return sort(SortMethod.fromName(method), data, SortConfig.fromMap(ctx));
   }


   public static <T extends Comparable<? super T>> SortResult<T> sort(SortMethod method, T[] data, SortConfig cfg)
   {
      if (method == null)
         throw new UnknownMethodException(null);

      if (data == null)
         throw new NullPointerException("Invalid null array parameter");

      if (cfg == null)
         cfg = SortConfig.DEFAULT;

      final Ordering<T> cmp = cfg.getDirection().ordering();

      if (cfg.isBuildIndex() == false)
      {
         final T[] res = (cfg.isInPlace()) ? data : data.clone();
         SorterFactory.<T>newSorter(method, cmp, cfg).sort(res, 0, res.length);
         return new SortResult<>(res, null);
      }

      final int length = data.length;
      final Integer[] positions = IndexOrdering.identity(length);
      final Sorter<Integer> sorter = SorterFactory.<Integer>newSorter(method, new IndexOrdering<>(data, cmp), cfg);
      sorter.sort(positions, 0, length);
      final int[] index = new int[length];
      final T[] sorted = data.clone();

      for (int i=0; i<length; i++)
      {
         index[i] = positions[i];
         sorted[i] = data[index[i]];
      }

      if (cfg.isInPlace() == false)
         return new SortResult<>(sorted, index);

      System.arraycopy(sorted, 0, data, 0, length);
      return new SortResult<>(data, index);
   }


   public static <T extends Comparable<? super T>> SortResult<T> bubbleSort(T[] data)
   {
      return sort(SortMethod.BUBBLE, data, SortConfig.DEFAULT);
   }


   public static <T extends Comparable<? super T>> SortResult<T> bubbleSort(T[] data, SortConfig cfg)
   {
      return sort(SortMethod.BUBBLE, data, cfg);
   }


   public static <T extends Comparable<? super T>> SortResult<T> shortBubbleSort(T[] data)
   {
      return sort(SortMethod.SHORT_BUBBLE, data, SortConfig.DEFAULT);
   }


   public static <T extends Comparable<? super T>> SortResult<T> shortBubbleSort(T[] data, SortConfig cfg)
   {
      return sort(SortMethod.SHORT_BUBBLE, data, cfg);
   }


   public static <T extends Comparable<? super T>> SortResult<T> selectionSort(T[] data)
   {
      return sort(SortMethod.SELECTION, data, SortConfig.DEFAULT);
   }


   public static <T extends Comparable<? super T>> SortResult<T> selectionSort(T[] data, SortConfig cfg)
   {
      return sort(SortMethod.SELECTION, data, cfg);
   }


   public static <T extends Comparable<? super T>> SortResult<T> insertionSort(T[] data)
   {
      return sort(SortMethod.INSERTION, data, SortConfig.DEFAULT);
   }


   public static <T extends Comparable<? super T>> SortResult<T> insertionSort(T[] data, SortConfig cfg)
   {
      return sort(SortMethod.INSERTION, data, cfg);
   }


   public static <T extends Comparable<? super T>> SortResult<T> shellSort(T[] data)
   {
      return sort(SortMethod.SHELL, data, SortConfig.DEFAULT);
   }


   public static <T extends Comparable<? super T>> SortResult<T> shellSort(T[] data, SortConfig cfg)
   {
      return sort(SortMethod.SHELL, data, cfg);
   }


   public static <T extends Comparable<? super T>> SortResult<T> quickSort(T[] data)
   {
      return sort(SortMethod.QUICK, data, SortConfig.DEFAULT);
   }


   public static <T extends Comparable<? super T>> SortResult<T> quickSort(T[] data, SortConfig cfg)
   {
      return sort(SortMethod.QUICK, data, cfg);
   }


   public static <T extends Comparable<? super T>> SortResult<T> mergeSort(T[] data)
   {
      return sort(SortMethod.MERGE, data, SortConfig.DEFAULT);
   }


   public static <T extends Comparable<? super T>> SortResult<T> mergeSort(T[] data, SortConfig cfg)
   {
      return sort(SortMethod.MERGE, data, cfg);
   }


   public static <T extends Comparable<? super T>> SortResult<T> heapSort(T[] data)
   {
      return sort(SortMethod.HEAP, data, SortConfig.DEFAULT);
   }


   public static <T extends Comparable<? super T>> SortResult<T> heapSort(T[] data, SortConfig cfg)
   {
      return sort(SortMethod.HEAP, data, cfg);
   }


   // Return the first index holding 'target' or NOT_FOUND
   public static int sequentialSearch(Object[] data, Object target)
   {
      return SequentialSearch.search(data, target);
   }


   // Precondition (not checked): 'data' is sorted in ascending order.
   // Return the index of one element equal to 'target' or NOT_FOUND
   public static <T extends Comparable<? super T>> int binarySearch(T[] data, T target)
   {
      return BinarySearch.search(data, target);
   }


   public static void reverse(Object[] data)
   {
      if (data == null)
         throw new NullPointerException("Invalid null array parameter");

      for (int i=0, j=data.length-1; i<j; i++, j--)
      {
         final Object tmp = data[i];
         data[i] = data[j];
         data[j] = tmp;
      }
   }


   public static void reverse(int[] data)
   {
      if (data == null)
         throw new NullPointerException("Invalid null array parameter");

      for (int i=0, j=data.length-1; i<j; i++, j--)
      {
         final int tmp = data[i];
         data[i] = data[j];
         data[j] = tmp;
      }
   }


   // Rebuild the index array of 'sorted' (a sorted permutation of 'original')
   // such that sorted[k] == original[index[k]]. Duplicates are mapped to
   // successive original positions, so the result is always a permutation.
   public static <T extends Comparable<? super T>> int[] buildIndex(T[] sorted, T[] original)
   {
      if ((sorted == null) || (original == null))
         throw new NullPointerException("Invalid null array parameter");

      if (sorted.length != original.length)
      {
         throw new InvalidParameterException("Sorted and original arrays differ in length: "+
            sorted.length+" vs "+original.length);
      }

      final int length = original.length;
      final boolean[] used = new boolean[length];
      final int[] index = new int[length];

      for (int k=0; k<length; k++)
      {
         int idx = NOT_FOUND;

         for (int i=0; i<length; i++)
         {
            if ((used[i] == false) && (Direction.compare(sorted[k], original[i]) == 0))
            {
               idx = i;
               break;
            }
         }

         if (idx == NOT_FOUND)
            throw new InvalidParameterException("Value "+sorted[k]+" at position "+k+" is not in the original array");

         used[idx] = true;
         index[k] = idx;
      }

      return index;
   }


   public static <T extends Comparable<? super T>> boolean isSorted(T[] data, boolean ascending)
   {
      if (data == null)
         throw new NullPointerException("Invalid null array parameter");

      final Ordering<T> cmp = Direction.of(ascending).ordering();

      for (int i=1; i<data.length; i++)
      {
         if (cmp.before(data[i], data[i-1]))
            return false;
      }

      return true;
   }
}
