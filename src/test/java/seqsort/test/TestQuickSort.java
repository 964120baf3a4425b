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
import org.junit.Assert;
import org.junit.Test;
import seqsort.InvalidParameterException;
import seqsort.SortResult;
import seqsort.Sorting;
import seqsort.util.sort.Direction;
import seqsort.util.sort.PivotStrategy;
import seqsort.util.sort.QuickSort;
import seqsort.util.sort.SortConfig;
import seqsort.util.sort.SortMethod;


public class TestQuickSort extends TestAbstractSort
{
   @Test
   public void testPivotStrategies()
   {
      final Integer[] data = box(54, 26, 93, 17, 77, 31, 44, 55, 20, 26, 93);

      for (PivotStrategy ps : new PivotStrategy[] { PivotStrategy.FIRST, PivotStrategy.LAST,
         PivotStrategy.MIDDLE, PivotStrategy.MEDIAN_OF_THREE })
      {
         final SortConfig cfg = SortConfig.DEFAULT.withPivot(ps).withIndex(true);
         check(ps.name(), data, Sorting.quickSort(data, cfg), true, false);
         check(ps.name(), data, Sorting.quickSort(data, cfg.withAscending(false)), false, false);
      }

      for (double pos : new double[] { 0.0, 0.25, 0.5, 1.0 })
      {
         final SortConfig cfg = SortConfig.DEFAULT.withPivotPosition(pos).withIndex(true);
         check("position " + pos, data, Sorting.quickSort(data, cfg), true, false);
      }

      for (int idx=0; idx<data.length; idx++)
      {
         final SortConfig cfg = SortConfig.DEFAULT.withPivotIndex(idx).withIndex(true);
         check("index " + idx, data, Sorting.quickSort(data, cfg), true, false);
      }
   }


   @Test
   public void testPivotIndexOutOfRange()
   {
      try
      {
         Sorting.quickSort(box(3, 1, 2), SortConfig.DEFAULT.withPivotIndex(3));
         Assert.fail("Pivot index 3 accepted for 3 elements");
      }
      catch (InvalidParameterException e)
      {
         Assert.assertTrue(e.getMessage(), e.getMessage().contains("3"));
      }

      try
      {
         SortConfig.DEFAULT.withPivotIndex(-1);
         Assert.fail("Negative pivot index accepted");
      }
      catch (InvalidParameterException e)
      {
         // expected
      }

      try
      {
         SortConfig.DEFAULT.withPivotPosition(1.5);
         Assert.fail("Pivot position 1.5 accepted");
      }
      catch (InvalidParameterException e)
      {
         // expected
      }

      // Empty input: nothing to partition
      Assert.assertEquals(0, Sorting.quickSort(new Integer[0], SortConfig.DEFAULT.withPivotIndex(5)).getData().length);
   }


   @Test
   public void testAdversarialInputs()
   {
      // Sorted, reversed and constant inputs with the first element as pivot
      // would recurse n levels deep without the depth budget
      final int size = 200000;
      final Integer[] sorted = new Integer[size];
      final Integer[] reversed = new Integer[size];
      final Integer[] constant = new Integer[size];

      for (int i=0; i<size; i++)
      {
         sorted[i] = i;
         reversed[i] = size - i;
         constant[i] = 3;
      }

      for (Integer[] data : Arrays.asList(sorted, reversed, constant))
      {
         for (PivotStrategy ps : new PivotStrategy[] { PivotStrategy.FIRST, PivotStrategy.LAST })
         {
            final SortResult<Integer> res = Sorting.quickSort(data, SortConfig.DEFAULT.withPivot(ps));
            Assert.assertTrue(ps.name(), Sorting.isSorted(res.getData(), true));
         }
      }
   }


   @Test
   public void testRange()
   {
      final Integer[] data = box(9, 8, 7, 6, 5, 4, 3, 2, 1);
      final QuickSort<Integer> qs = new QuickSort<>(Direction.ASCENDING.<Integer>ordering(), PivotStrategy.MEDIAN_OF_THREE);
      Assert.assertTrue(qs.sort(data, 2, 5));
      Assert.assertArrayEquals(box(9, 8, 3, 4, 5, 6, 7, 2, 1), data);
      Assert.assertFalse(qs.sort(data, 5, 5));
      Assert.assertFalse(qs.sort(data, -1, 2));
      Assert.assertFalse(qs.sort(null, 0, 0));
   }


   @Test
   public void testRandom()
   {
      testCorrectness(SortMethod.QUICK, 20, 3000);
   }
}
