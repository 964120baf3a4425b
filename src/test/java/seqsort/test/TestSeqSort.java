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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.util.HashMap;
import java.util.Map;
import org.junit.Assert;
import org.junit.Test;
import seqsort.Error;
import seqsort.app.SeqSort;
import seqsort.util.sort.PivotStrategy;


public class TestSeqSort
{
   private static String run(int expectedStatus, String... args) throws UnsupportedEncodingException
   {
      Map<String, Object> map = new HashMap<>();
      Assert.assertEquals(0, SeqSort.processCommandLine(args, map));
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      PrintStream ps = new PrintStream(baos, true, "UTF-8");
      Assert.assertEquals(expectedStatus, new SeqSort(map, ps).call().intValue());
      return baos.toString("UTF-8");
   }


   @Test
   public void testSortNumbers() throws UnsupportedEncodingException
   {
      String output = run(0, "-m", "quick", "--descending", "--index", "5", "3", "1", "4", "2");
      Assert.assertTrue(output, output.contains("sorted = [5, 4, 3, 2, 1]"));
      Assert.assertTrue(output, output.contains("index = [0, 3, 1, 4, 2]"));

      output = run(0, "--method=shell", "--gap=2", "2.5", "-1", "0.25");
      Assert.assertTrue(output, output.contains("sorted = [-1.0, 0.25, 2.5]"));
      Assert.assertFalse(output, output.contains("index"));
   }


   @Test
   public void testSortStrings() throws UnsupportedEncodingException
   {
      String output = run(0, "--method=heap", "d", "f", "a", "k", "b", "g", "z");
      Assert.assertTrue(output, output.contains("sorted = [a, b, d, f, g, k, z]"));

      output = run(0, "--strings", "10", "9", "100");
      Assert.assertTrue(output, output.contains("sorted = [10, 100, 9]"));
   }


   @Test
   public void testSearch() throws UnsupportedEncodingException
   {
      String output = run(0, "--search=17", "54", "26", "93", "17", "77");
      Assert.assertTrue(output, output.contains("17 found at index 3"));

      output = run(0, "-s", "4", "-b", "--descending", "5", "3", "1", "4", "2");
      Assert.assertTrue(output, output.contains("4 found at index 1 in the sorted data"));

      output = run(0, "--search=6", "--binary", "5", "3", "1");
      Assert.assertTrue(output, output.contains("6 not found"));

      // In place, the position is reported in the sorted data
      output = run(0, "--in-place", "--search=17", "54", "26", "93", "17", "77");
      Assert.assertTrue(output, output.contains("17 found at index 0 in the sorted data"));

      output = run(0, "--search=2.5", "3.5", "2.5", "1");
      Assert.assertTrue(output, output.contains("2.5 found at index 1"));

      run(Error.ERR_INVALID_PARAM, "--search=x", "3", "1");
   }


   @Test
   public void testErrors() throws UnsupportedEncodingException
   {
      run(Error.ERR_UNKNOWN_METHOD, "--method=bogo", "3", "1");
      run(Error.ERR_INVALID_PARAM, "--method=shell", "--gap=5", "3", "1");
      run(Error.ERR_INVALID_PARAM, "--method=quick", "--pivot=index:7", "3", "1");
      run(Error.ERR_MISSING_PARAM);

      Map<String, Object> map = new HashMap<>();
      Assert.assertEquals(Error.ERR_INVALID_PARAM, SeqSort.processCommandLine(new String[] { "--verbose=9" }, map));
      Assert.assertEquals(Error.ERR_INVALID_PARAM, SeqSort.processCommandLine(new String[] { "--gap=x" }, map));
      Assert.assertEquals(Error.ERR_INVALID_PARAM, SeqSort.processCommandLine(new String[] { "--pivot=random" }, map));
      Assert.assertEquals(Error.ERR_INVALID_PARAM, SeqSort.processCommandLine(new String[] { "--colour" }, map));
   }


   @Test
   public void testCommandLine()
   {
      Map<String, Object> map = new HashMap<>();
      String[] args = { "-m", "quick", "-p", "median3", "-v", "2", "--in-place", "-x", "3", "1" };
      Assert.assertEquals(0, SeqSort.processCommandLine(args, map));
      Assert.assertEquals("quick", map.get("method"));
      Assert.assertEquals(PivotStrategy.MEDIAN_OF_THREE, map.get("pivot"));
      Assert.assertEquals(2, map.get("verbose"));
      Assert.assertEquals(Boolean.TRUE, map.get("inPlace"));
      Assert.assertEquals(Boolean.TRUE, map.get("buildIndex"));
      Assert.assertArrayEquals(new String[] { "3", "1" }, (String[]) map.get("values"));

      map.clear();
      Assert.assertEquals(0, SeqSort.processCommandLine(new String[] { "--pivot=0.5" }, map));
      Assert.assertEquals(Double.valueOf(0.5), map.get("pivot"));
      map.clear();
      Assert.assertEquals(0, SeqSort.processCommandLine(new String[] { "--pivot=index:2" }, map));
      Assert.assertEquals(Integer.valueOf(2), map.get("pivot"));
   }


   @Test
   public void testTrailingOptionWithoutValue() throws UnsupportedEncodingException
   {
      // The dangling option is ignored with a warning
      Map<String, Object> map = new HashMap<>();
      Assert.assertEquals(0, SeqSort.processCommandLine(new String[] { "3", "1", "-m" }, map));
      Assert.assertNull(map.get("method"));
      Assert.assertArrayEquals(new String[] { "3", "1" }, (String[]) map.get("values"));

      String output = run(0, "3", "1", "-s");
      Assert.assertTrue(output, output.contains("sorted = [1, 3]"));
      Assert.assertFalse(output, output.contains("found"));
   }


   @Test
   public void testDemo() throws UnsupportedEncodingException
   {
      String output = run(0, "--demo");
      Assert.assertTrue(output, output.contains("sorted = [17, 20, 26, 31, 44, 54, 55, 77, 93], index = [3, 8, 1, 5, 6, 0, 7, 4, 2]"));
      Assert.assertTrue(output, output.contains("sorted = [93, 77, 55, 54, 44, 31, 26, 20, 17], index = [2, 4, 7, 0, 6, 5, 1, 8, 3]"));
      Assert.assertTrue(output, output.contains("binary search 56 in [17, 20, 26, 31, 44, 54, 55, 77, 93]: -1"));
   }
}
