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

package seqsort.test;

import java.util.Arrays;
import java.util.Random;
import org.junit.Assert;
import org.junit.Test;
import seqsort.EmptyHeapException;
import seqsort.Error;
import seqsort.InvalidModeException;
import seqsort.Ordering;
import seqsort.util.BinaryHeap;


public class TestBinaryHeap
{
   @Test
   public void testConstruction()
   {
      BinaryHeap<Integer> max = BinaryHeap.newHeap(new Integer[] { 5, 3, 1, 4, 2 }, "max");
      Assert.assertEquals(BinaryHeap.Mode.MAX, max.getMode());
      Assert.assertEquals(5, max.size());
      Assert.assertTrue(max.isValid());
      Assert.assertEquals(Integer.valueOf(5), max.peekRoot());
      Assert.assertEquals(5, max.size());

      BinaryHeap<Integer> min = BinaryHeap.newHeap(new Integer[] { 5, 3, 1, 4, 2 }, BinaryHeap.Mode.MIN);
      Assert.assertEquals(Integer.valueOf(1), min.peekRoot());

      for (int i=1; i<=5; i++)
         Assert.assertEquals(Integer.valueOf(i), min.extractRoot());

      Assert.assertTrue(min.isEmpty());

      BinaryHeap<String> empty = BinaryHeap.newHeap("Min");
      Assert.assertTrue(empty.isEmpty());
      Assert.assertEquals(0, empty.size());
   }


   @Test
   public void testInputNotModified()
   {
      final Integer[] data = { 4, 8, 1, 9, 3 };
      BinaryHeap<Integer> heap = BinaryHeap.newHeap(data, BinaryHeap.Mode.MAX);
      heap.extractRoot();
      heap.insert(0);
      Assert.assertArrayEquals(new Integer[] { 4, 8, 1, 9, 3 }, data);
   }


   @Test
   public void testInvalidMode()
   {
      for (String mode : new String[] { "median", "", null })
      {
         try
         {
            BinaryHeap.<Integer>newHeap(mode);
            Assert.fail("Mode " + mode + " accepted");
         }
         catch (InvalidModeException e)
         {
            Assert.assertEquals(Error.ERR_INVALID_MODE, e.getErrorCode());
            Assert.assertTrue(e.getMessage(), e.getMessage().contains(String.valueOf(mode)));
         }
      }

      try
      {
         BinaryHeap.newHeap(new Integer[] { 1 }, (BinaryHeap.Mode) null);
         Assert.fail("Null mode accepted");
      }
      catch (InvalidModeException e)
      {
         // expected
      }
   }


   @Test
   public void testEmptyHeap()
   {
      BinaryHeap<Integer> heap = BinaryHeap.newHeap(BinaryHeap.Mode.MIN);

      try
      {
         heap.peekRoot();
         Assert.fail("Peek on empty heap succeeded");
      }
      catch (EmptyHeapException e)
      {
         Assert.assertEquals(Error.ERR_EMPTY_HEAP, e.getErrorCode());
      }

      heap.insert(3);
      Assert.assertEquals(Integer.valueOf(3), heap.extractRoot());

      try
      {
         heap.extractRoot();
         Assert.fail("Extract on empty heap succeeded");
      }
      catch (EmptyHeapException e)
      {
         Assert.assertEquals(Error.ERR_EMPTY_HEAP, e.getErrorCode());
      }
   }


   @Test
   public void testRandomOperations()
   {
      System.out.println("Correctness Test");
      Random random = new Random();

      for (BinaryHeap.Mode mode : BinaryHeap.Mode.values())
      {
         for (int ii=0; ii<20; ii++)
         {
            final Integer[] initial = new Integer[random.nextInt(50)];

            for (int i=0; i<initial.length; i++)
               initial[i] = random.nextInt(100);

            BinaryHeap<Integer> heap = BinaryHeap.newHeap(initial, mode);
            Assert.assertTrue(heap.isValid());

            // Reference: the current content, sorted in the heap order
            int[] content = new int[initial.length];

            for (int i=0; i<initial.length; i++)
               content[i] = initial[i];

            int size = content.length;

            for (int op=0; op<500; op++)
            {
               if ((size == 0) || (random.nextInt(3) != 0))
               {
                  final int val = random.nextInt(100) - 50;
                  heap.insert(val);

                  if (size == content.length)
                     content = Arrays.copyOf(content, 2*size+1);

                  content[size++] = val;
               }
               else
               {
                  Arrays.sort(content, 0, size);
                  final int expected = (mode == BinaryHeap.Mode.MIN) ? content[0] : content[size-1];
                  Assert.assertEquals(expected, heap.peekRoot().intValue());
                  Assert.assertEquals(expected, heap.extractRoot().intValue());

                  if (mode == BinaryHeap.Mode.MIN)
                     System.arraycopy(content, 1, content, 0, size-1);

                  size--;
               }

               Assert.assertEquals(size, heap.size());
               Assert.assertTrue("Heap order violated after operation " + op, heap.isValid());
            }

            heap.clear();
            Assert.assertTrue(heap.isEmpty());
         }
      }
   }


   @Test
   public void testCustomOrdering()
   {
      // Shortest string first
      Ordering<String> shortest = new Ordering<String>()
      {
         @Override
         public boolean before(String a, String b)
         {
            return a.length() < b.length();
         }
      };

      BinaryHeap<String> heap = new BinaryHeap<>(shortest);
      Assert.assertNull(heap.getMode());

      for (String s : new String[] { "xxx", "x", "xxxxx", "xx", "xxxx" })
         heap.insert(s);

      Assert.assertEquals(5, heap.toArray().length);

      for (int len=1; len<=5; len++)
         Assert.assertEquals(len, heap.extractRoot().length());
   }
}
