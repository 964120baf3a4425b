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

package seqsort.util;

import java.util.Arrays;
import java.util.Locale;
import seqsort.EmptyHeapException;
import seqsort.InvalidModeException;
import seqsort.Ordering;
import seqsort.util.sort.Direction;


// Binary heap over a growable array. The root is the 'best' element: the
// smallest one in MIN mode, the largest one in MAX mode or, more generally,
// the element placed first by the heap ordering.
// Every element is at worst equal to its children (heap-order invariant),
// insert and extractRoot run in O(log n), construction from an array in O(n).
// Not thread safe.
public final class BinaryHeap<T>
{
   private static final int DEFAULT_CAPACITY = 16;

   public enum Mode
   {
      MIN,
      MAX;


      public static Mode fromName(String name)
      {
         if (name == null)
            throw new InvalidModeException(null);

         switch (name.trim().toUpperCase(Locale.ROOT))
         {
            case "MIN":
               return MIN;

            case "MAX":
               return MAX;

            default:
               throw new InvalidModeException(name);
         }
      }


      public Direction direction()
      {
         return (this == MIN) ? Direction.ASCENDING : Direction.DESCENDING;
      }
   }


   private final Ordering<? super T> ordering;
   private final Mode mode;
   private Object[] data;
   private int size;


   public BinaryHeap(Ordering<? super T> ordering)
   {
      this(ordering, null, null, 0, 0);
   }


   // The 'len' elements at 'blkptr' are copied, the input array is not modified
   public BinaryHeap(Ordering<? super T> ordering, T[] initial, int blkptr, int len)
   {
      this(ordering, null, initial, blkptr, len);
   }


   private BinaryHeap(Ordering<? super T> ordering, Mode mode, T[] initial, int blkptr, int len)
   {
      if (ordering == null)
         throw new NullPointerException("Invalid null ordering parameter");

      this.ordering = ordering;
      this.mode = mode;

      if (initial == null)
      {
         this.data = new Object[DEFAULT_CAPACITY];
         return;
      }

      if ((blkptr < 0) || (len < 0) || (blkptr+len > initial.length))
         throw new IllegalArgumentException("Invalid range: start="+blkptr+", length="+len);

      this.data = new Object[Math.max(len, DEFAULT_CAPACITY)];
      System.arraycopy(initial, blkptr, this.data, 0, len);
      this.size = len;

      // Bottom-up heapify: sift down every internal node, last one first
      for (int i=(len>>1)-1; i>=0; i--)
         this.siftDown(i);
   }


   public static <T extends Comparable<? super T>> BinaryHeap<T> newHeap(Mode mode)
   {
      return newHeap(null, mode);
   }


   public static <T extends Comparable<? super T>> BinaryHeap<T> newHeap(String mode)
   {
      return newHeap(null, Mode.fromName(mode));
   }


   public static <T extends Comparable<? super T>> BinaryHeap<T> newHeap(T[] initial, String mode)
   {
      return newHeap(initial, Mode.fromName(mode));
   }


   public static <T extends Comparable<? super T>> BinaryHeap<T> newHeap(T[] initial, Mode mode)
   {
      if (mode == null)
         throw new InvalidModeException(null);

      final Ordering<T> ord = mode.direction().ordering();
      final int len = (initial == null) ? 0 : initial.length;
      return new BinaryHeap<>(ord, mode, initial, 0, len);
   }


   // Null when the heap was built with a custom ordering
   public Mode getMode()
   {
      return this.mode;
   }


   public int size()
   {
      return this.size;
   }


   public boolean isEmpty()
   {
      return this.size == 0;
   }


   public void clear()
   {
      Arrays.fill(this.data, 0, this.size, null);
      this.size = 0;
   }


   public void insert(T value)
   {
      if (this.size == this.data.length)
         this.data = Arrays.copyOf(this.data, this.data.length << 1);

      this.data[this.size] = value;
      this.siftUp(this.size);
      this.size++;
   }


   public T peekRoot()
   {
      if (this.size == 0)
         throw new EmptyHeapException("peek the root");

      return this.elementAt(0);
   }


   public T extractRoot()
   {
      if (this.size == 0)
         throw new EmptyHeapException("extract the root");

      final T root = this.elementAt(0);
      this.size--;
      this.data[0] = this.data[this.size];
      this.data[this.size] = null;

      if (this.size > 1)
         this.siftDown(0);

      return root;
   }


   // Copy of the backing sequence, in heap order
   public Object[] toArray()
   {
      return Arrays.copyOf(this.data, this.size);
   }


   // Check the heap-order invariant: no child placed before its parent
   public boolean isValid()
   {
      for (int i=1; i<this.size; i++)
      {
         if (this.ordering.before(this.elementAt(i), this.elementAt((i-1)>>1)))
            return false;
      }

      return true;
   }


   @SuppressWarnings("unchecked")
   private T elementAt(int idx)
   {
      return (T) this.data[idx];
   }


   private void siftUp(int idx)
   {
      final T val = this.elementAt(idx);

      while (idx > 0)
      {
         final int parent = (idx-1) >> 1;

         // Stop on ties: equal elements keep their relative heap position
         if (this.ordering.before(val, this.elementAt(parent)) == false)
            break;

         this.data[idx] = this.data[parent];
         idx = parent;
      }

      this.data[idx] = val;
   }


   private void siftDown(int idx)
   {
      final T val = this.elementAt(idx);
      final int half = this.size >> 1;

      while (idx < half)
      {
         int child = (idx<<1) + 1;
         final int right = child + 1;

         if ((right < this.size) && (this.ordering.before(this.elementAt(right), this.elementAt(child))))
            child = right;

         if (this.ordering.before(this.elementAt(child), val) == false)
            break;

         this.data[idx] = this.data[child];
         idx = child;
      }

      this.data[idx] = val;
   }
}
