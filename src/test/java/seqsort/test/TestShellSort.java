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

import java.util.HashMap;
import java.util.Map;
import org.junit.Assert;
import org.junit.Test;
import seqsort.Error;
import seqsort.InvalidParameterException;
import seqsort.Sorting;
import seqsort.util.sort.SortConfig;
import seqsort.util.sort.SortMethod;


public class TestShellSort extends TestAbstractSort
{
   @Test
   public void testGaps()
   {
      final Integer[] data = box(54, 26, 93, 17, 77, 31, 44, 55, 20);

      for (int gap=1; gap<=data.length; gap++)
      {
         final SortConfig cfg = SortConfig.DEFAULT.withGap(gap).withIndex(true);
         check("gap " + gap, data, Sorting.shellSort(data, cfg), true, false);
         check("gap " + gap, data, Sorting.shellSort(data, cfg.withAscending(false)), false, false);
      }
   }


   @Test
   public void testInvalidGaps()
   {
      try
      {
         Sorting.shellSort(box(3, 2, 1), SortConfig.DEFAULT.withGap(4));
         Assert.fail("Gap larger than the sequence accepted");
      }
      catch (InvalidParameterException e)
      {
         Assert.assertEquals(Error.ERR_INVALID_PARAM, e.getErrorCode());
         Assert.assertTrue(e.getMessage(), e.getMessage().contains("4"));
      }

      for (int gap : new int[] { 0, -3 })
      {
         try
         {
            SortConfig.DEFAULT.withGap(gap);
            Assert.fail("Gap " + gap + " accepted");
         }
         catch (InvalidParameterException e)
         {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains(String.valueOf(gap)));
         }
      }

      Map<String, Object> ctx = new HashMap<>();
      ctx.put("gap", "3");

      try
      {
         Sorting.sort("shell", box(3, 2, 1), ctx);
         Assert.fail("Non integer gap accepted");
      }
      catch (InvalidParameterException e)
      {
         // expected
      }

      // Empty input: only the sign of the gap matters
      Assert.assertEquals(0, Sorting.shellSort(new Integer[0], SortConfig.DEFAULT.withGap(10)).getData().length);
   }


   @Test
   public void testRandom()
   {
      testCorrectness(SortMethod.SHELL, 20, 1000);
   }
}
